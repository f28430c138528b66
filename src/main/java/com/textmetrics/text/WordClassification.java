package com.textmetrics.text;

public record WordClassification(
    String word,
    int syllables,
    boolean complex,
    boolean stopWord,
    boolean personalPronoun
) {
}
