package com.textmetrics.lexicon;

/**
 * 词表缺失或在所有候选编码下均无法解码。属于配置问题，而非用户输入问题。
 */
public class LexiconLoadException extends RuntimeException {
    private final String source;

    public LexiconLoadException(String message, String source) {
        super(message + ": " + source);
        this.source = source;
    }

    public LexiconLoadException(String message, String source, Throwable cause) {
        super(message + ": " + source, cause);
        this.source = source;
    }

    public String getSource() {
        return source;
    }
}
