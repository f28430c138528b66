package com.textmetrics.text;

import java.util.ArrayList;
import java.util.List;
import java.util.regex.Pattern;

public class WhitespaceTokenizer implements Tokenizer {

    private static final Pattern SPLIT_PATTERN = Pattern.compile("\\s+");

    /**
     * 按空白切分，保留顺序与重复词。
     */
    @Override
    public List<Token> tokenize(String text) {
        if (text == null || text.isEmpty()) {
            return List.of();
        }

        List<Token> tokens = new ArrayList<>();
        int nextPosition = 0;
        for (String segment : SPLIT_PATTERN.split(text)) {
            if (segment.isEmpty()) {
                continue;
            }
            tokens.add(new Token(segment, nextPosition));
            nextPosition++;
        }
        return List.copyOf(tokens);
    }
}
