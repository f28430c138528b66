package com.textmetrics.source;

public interface TextSource {

    /**
     * 读取待分析的纯文本。无可用文本时抛出 {@link InvalidInputException}。
     */
    String readText();

    /**
     * 用于报告输出的来源描述。
     */
    String describe();
}
