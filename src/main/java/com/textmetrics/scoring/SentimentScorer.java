package com.textmetrics.scoring;

import com.textmetrics.config.Constants;
import com.textmetrics.lexicon.Lexicon;
import com.textmetrics.text.Token;

import java.util.List;

/**
 * 基于词表计数的情感评分。输入应为已去除停用词的内容词。
 */
public class SentimentScorer {
    private final Lexicon positiveWords;
    private final Lexicon negativeWords;
    private final double epsilon;

    public SentimentScorer(Lexicon positiveWords, Lexicon negativeWords) {
        this(positiveWords, negativeWords, Constants.SCORE_EPSILON);
    }

    public SentimentScorer(Lexicon positiveWords, Lexicon negativeWords, double epsilon) {
        this.positiveWords = positiveWords;
        this.negativeWords = negativeWords;
        this.epsilon = epsilon <= 0 ? Constants.SCORE_EPSILON : epsilon;
    }

    /**
     * polarity = (P - N) / (P + N + ε)，subjectivity = 带情感词数 / (总词数 + ε)。
     * 同时出现在两个词表中的词在 P 与 N 中各计一次，在主观性中只计一次，保证其不超过 1。
     */
    public SentimentScore score(List<Token> contentTokens) {
        if (contentTokens == null || contentTokens.isEmpty()) {
            return new SentimentScore(0, 0, 0, 0.0, 0.0);
        }

        int positiveCount = 0;
        int negativeCount = 0;
        int chargedCount = 0;
        for (Token token : contentTokens) {
            boolean positive = positiveWords.contains(token.term());
            boolean negative = negativeWords.contains(token.term());
            if (positive) {
                positiveCount++;
            }
            if (negative) {
                negativeCount++;
            }
            if (positive || negative) {
                chargedCount++;
            }
        }

        int tokenCount = contentTokens.size();
        double polarity = (positiveCount - negativeCount) / (positiveCount + negativeCount + epsilon);
        double subjectivity = chargedCount / (tokenCount + epsilon);
        return new SentimentScore(positiveCount, negativeCount, tokenCount, polarity, subjectivity);
    }
}
