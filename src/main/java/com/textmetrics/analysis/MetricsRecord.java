package com.textmetrics.analysis;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * 一次分析的完整结果，所有字段同时产生。
 */
public record MetricsRecord(
    int positiveScore,
    int negativeScore,
    double polarityScore,
    double subjectivityScore,
    int sentenceCount,
    double averageSentenceLength,
    double percentageComplexWords,
    double fogIndex,
    int complexWordCount,
    int wordCount,
    double averageWordLength,
    double syllablesPerWord,
    int personalPronounCount,
    int stopWordCount
) {

    @JsonProperty("sentimentLabel")
    public SentimentLabel sentimentLabel() {
        return SentimentLabel.fromPolarity(polarityScore);
    }
}
