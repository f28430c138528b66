package com.textmetrics.analysis;

public enum SentimentLabel {
    POSITIVE,
    NEGATIVE,
    NEUTRAL;

    public static SentimentLabel fromPolarity(double polarity) {
        if (polarity > 0) {
            return POSITIVE;
        }
        if (polarity < 0) {
            return NEGATIVE;
        }
        return NEUTRAL;
    }
}
