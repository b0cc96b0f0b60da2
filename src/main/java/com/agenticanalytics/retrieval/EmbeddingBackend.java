package com.agenticanalytics.retrieval;

import java.io.IOException;
import java.util.List;

public interface EmbeddingBackend {
    List<float[]> encode(List<String> texts) throws IOException;

    String modelName();
}
