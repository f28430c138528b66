package com.textmetrics.text;

import java.util.Locale;

/**
 * 文本归一化：转小写并删除固定的 ASCII 标点集合。
 */
public final class TextNormalizer {

    public static final String PUNCTUATION = "!\"#$%&'()*+,-./:;<=>?@[\\]^_`{|}~";

    private TextNormalizer() {
    }

    public static String normalize(String text) {
        if (text == null || text.isEmpty()) {
            return "";
        }
        String lowerCased = text.toLowerCase(Locale.ROOT);
        StringBuilder builder = new StringBuilder(lowerCased.length());
        for (int index = 0; index < lowerCased.length(); index++) {
            char currentChar = lowerCased.charAt(index);
            if (PUNCTUATION.indexOf(currentChar) < 0) {
                builder.append(currentChar);
            }
        }
        return builder.toString();
    }
}
