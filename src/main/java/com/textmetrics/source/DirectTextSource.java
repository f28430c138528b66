package com.textmetrics.source;

public class DirectTextSource implements TextSource {
    private final String text;

    public DirectTextSource(String text) {
        this.text = text;
    }

    @Override
    public String readText() {
        if (text == null || text.isBlank()) {
            throw new InvalidInputException("输入文本为空", "请输入要分析的文本");
        }
        return text;
    }

    @Override
    public String describe() {
        return "text";
    }
}
