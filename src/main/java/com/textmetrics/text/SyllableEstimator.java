package com.textmetrics.text;

import java.util.Locale;

/**
 * 基于元音组的英文音节估算。
 *
 * <p>启发式规则对不规则拼写会有偏差，可读性指标本身即为近似值。</p>
 */
public final class SyllableEstimator {

    private static final String VOWELS = "aeiouy";

    private SyllableEstimator() {
    }

    /**
     * 估算单词音节数。非空单词至少返回 1，空串返回 0。
     */
    public static int estimate(String word) {
        if (word == null || word.isEmpty()) {
            return 0;
        }
        String lowerWord = word.toLowerCase(Locale.ROOT);

        int count = 0;
        boolean previousVowel = false;
        for (int index = 0; index < lowerWord.length(); index++) {
            boolean currentVowel = isVowel(lowerWord.charAt(index));
            if (currentVowel && !previousVowel) {
                count++;
            }
            previousVowel = currentVowel;
        }

        if (count > 1 && hasSilentE(lowerWord)) {
            count--;
        }
        return Math.max(count, 1);
    }

    static boolean isVowel(char ch) {
        return VOWELS.indexOf(ch) >= 0;
    }

    // 以 e 结尾、不以 le 结尾，且 e 前为辅音字母
    private static boolean hasSilentE(String word) {
        if (word.length() < 2 || !word.endsWith("e") || word.endsWith("le")) {
            return false;
        }
        char before = word.charAt(word.length() - 2);
        return Character.isLetter(before) && !isVowel(before);
    }
}
