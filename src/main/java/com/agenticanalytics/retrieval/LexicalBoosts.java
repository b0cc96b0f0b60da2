package com.agenticanalytics.retrieval;

public record LexicalBoosts(float exactMatch, float threeOrMoreWords, float twoWords, float oneWord) {
    public static LexicalBoosts defaults() {
        return new LexicalBoosts(1.3f, 1.2f, 1.1f, 1.05f);
    }

    float forOverlap(int sharedWords) {
        if (sharedWords >= 3) {
            return threeOrMoreWords;
        }
        if (sharedWords == 2) {
            return twoWords;
        }
        if (sharedWords == 1) {
            return oneWord;
        }
        return 1.0f;
    }
}
