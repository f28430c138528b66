package com.textmetrics.scoring;

public record SentimentScore(
    int positiveCount,
    int negativeCount,
    int tokenCount,
    double polarity,
    double subjectivity
) {
}
