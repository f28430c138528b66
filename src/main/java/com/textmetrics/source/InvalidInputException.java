package com.textmetrics.source;

/**
 * 待分析文本为空或无法获取。附带给用户的修正建议。
 */
public class InvalidInputException extends RuntimeException {
    private final String suggestion;

    public InvalidInputException(String message, String suggestion) {
        super(message);
        this.suggestion = suggestion;
    }

    public InvalidInputException(String message, String suggestion, Throwable cause) {
        super(message, cause);
        this.suggestion = suggestion;
    }

    public String getSuggestion() {
        return suggestion;
    }
}
