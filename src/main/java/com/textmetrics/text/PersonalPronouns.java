package com.textmetrics.text;

import java.util.Locale;
import java.util.Set;

public final class PersonalPronouns {

    public static final Set<String> ENGLISH = Set.of(
        "i", "me", "my", "mine", "myself",
        "you", "your", "yours", "yourself", "yourselves",
        "he", "him", "his", "himself",
        "she", "her", "hers", "herself",
        "it", "its", "itself",
        "we", "us", "our", "ours", "ourselves",
        "they", "them", "their", "theirs", "themselves"
    );

    private PersonalPronouns() {
    }

    /**
     * 整词、大小写无关地判断是否为人称代词。
     */
    public static boolean isPersonalPronoun(String term) {
        if (term == null || term.isEmpty()) {
            return false;
        }
        return ENGLISH.contains(term.toLowerCase(Locale.ROOT));
    }
}
