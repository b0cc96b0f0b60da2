package com.agenticanalytics.agent;

import java.io.IOException;
import java.util.List;

import com.agenticanalytics.retrieval.SearchResult;

@FunctionalInterface
public interface AnswerGenerator {
    GeneratedAnswer generate(String question, List<SearchResult> context) throws IOException;
}
