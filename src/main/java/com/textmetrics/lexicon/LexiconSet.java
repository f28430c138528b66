package com.textmetrics.lexicon;

import java.util.Objects;

/**
 * 一次分析所需的三个词表。
 */
public record LexiconSet(
    Lexicon positive,
    Lexicon negative,
    Lexicon stopWords
) {
    public LexiconSet {
        Objects.requireNonNull(positive, "正面词表不能为null");
        Objects.requireNonNull(negative, "负面词表不能为null");
        Objects.requireNonNull(stopWords, "停用词表不能为null");
    }
}
