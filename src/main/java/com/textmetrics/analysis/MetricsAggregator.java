package com.textmetrics.analysis;

import com.textmetrics.scoring.ReadabilityScore;
import com.textmetrics.scoring.SentimentScore;

/**
 * 将情感与可读性评分组装为 {@link MetricsRecord}，并统一校验数值不变式。
 */
public class MetricsAggregator {

    public MetricsRecord aggregate(SentimentScore sentiment, ReadabilityScore readability, int stopWordCount) {
        MetricsRecord metrics = new MetricsRecord(
            sentiment.positiveCount(),
            sentiment.negativeCount(),
            requireFinite("polarityScore", sentiment.polarity()),
            requireFinite("subjectivityScore", sentiment.subjectivity()),
            readability.sentenceCount(),
            requireFinite("averageSentenceLength", readability.averageSentenceLength()),
            requireFinite("percentageComplexWords", readability.percentageComplexWords()),
            requireFinite("fogIndex", readability.fogIndex()),
            readability.complexWordCount(),
            readability.wordCount(),
            requireFinite("averageWordLength", readability.averageWordLength()),
            requireFinite("syllablesPerWord", readability.syllablesPerWord()),
            readability.personalPronounCount(),
            stopWordCount
        );
        checkInvariants(metrics);
        return metrics;
    }

    private static double requireFinite(String field, double value) {
        if (!Double.isFinite(value)) {
            throw new IllegalStateException("指标 " + field + " 不是有限值: " + value);
        }
        return value;
    }

    private static void checkInvariants(MetricsRecord metrics) {
        if (metrics.wordCount() < 0 || metrics.complexWordCount() > metrics.wordCount()) {
            throw new IllegalStateException("复杂词数超出词数: " + metrics.complexWordCount() + " > " + metrics.wordCount());
        }
        if (metrics.polarityScore() < -1.0 || metrics.polarityScore() > 1.0) {
            throw new IllegalStateException("极性超出 [-1, 1]: " + metrics.polarityScore());
        }
        if (metrics.subjectivityScore() < 0.0 || metrics.subjectivityScore() > 1.0) {
            throw new IllegalStateException("主观性超出 [0, 1]: " + metrics.subjectivityScore());
        }
        if (metrics.fogIndex() < 0.0) {
            throw new IllegalStateException("Fog 指数为负: " + metrics.fogIndex());
        }
    }
}
