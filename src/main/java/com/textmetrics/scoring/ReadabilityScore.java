package com.textmetrics.scoring;

public record ReadabilityScore(
    int sentenceCount,
    int wordCount,
    int complexWordCount,
    int syllableCount,
    int characterCount,
    int personalPronounCount,
    double averageSentenceLength,
    double percentageComplexWords,
    double fogIndex,
    double averageWordLength,
    double syllablesPerWord
) {
}
