package com.textmetrics.text;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Set;

public class StopWordFilter {

    private final Set<String> stopWords;

    /**
     * @param stopWords 小写停用词集合，调用期间不得修改
     */
    public StopWordFilter(Set<String> stopWords) {
        this.stopWords = stopWords == null ? Set.of() : stopWords;
    }

    public boolean isStopWord(String term) {
        if (term == null || term.isEmpty()) {
            return false;
        }
        return stopWords.contains(term.toLowerCase(Locale.ROOT));
    }

    /**
     * 移除停用词，返回保留的词项与被移除的数量。
     */
    public FilterResult filter(List<Token> tokens) {
        if (tokens == null || tokens.isEmpty()) {
            return new FilterResult(List.of(), 0);
        }

        List<Token> kept = new ArrayList<>(tokens.size());
        int removedCount = 0;
        for (Token token : tokens) {
            if (isStopWord(token.term())) {
                removedCount++;
            } else {
                kept.add(token);
            }
        }
        return new FilterResult(List.copyOf(kept), removedCount);
    }

    public record FilterResult(List<Token> kept, int stopWordCount) {
    }
}
