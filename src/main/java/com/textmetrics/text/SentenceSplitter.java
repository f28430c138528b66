package com.textmetrics.text;

import java.util.ArrayList;
import java.util.List;
import java.util.regex.Pattern;

public class SentenceSplitter {

    private static final Pattern TERMINATOR_PATTERN = Pattern.compile("[.!?]+\\s*");

    /**
     * 按 . ! ? 切分句子，丢弃裁剪后为空的片段。空白输入返回空列表。
     */
    public List<String> split(String text) {
        if (text == null || text.isBlank()) {
            return List.of();
        }

        List<String> sentences = new ArrayList<>();
        for (String fragment : TERMINATOR_PATTERN.split(text)) {
            String trimmed = fragment.trim();
            if (!trimmed.isEmpty()) {
                sentences.add(trimmed);
            }
        }
        return List.copyOf(sentences);
    }
}
