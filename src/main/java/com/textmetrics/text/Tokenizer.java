package com.textmetrics.text;

import java.util.List;

public interface Tokenizer {

    /**
     * 将已归一化的文本切分为词项列表。
     */
    List<Token> tokenize(String text);
}
