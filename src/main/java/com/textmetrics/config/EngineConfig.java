package com.textmetrics.config;

import java.nio.file.Path;
import java.util.List;

/**
 * 引擎运行时配置
 * 
 * 支持从CLI参数注入，覆盖Constants默认值。词表路径为 null 时使用内置资源。
 */
public class EngineConfig {
    private Path positiveWordsPath;
    private Path negativeWordsPath;
    private Path stopWordsPath;
    private List<String> lexiconCharsets = Constants.LEXICON_CHARSETS;
    private int maxTextLength = Constants.MAX_TEXT_LENGTH;
    private int fetchTimeoutMillis = Constants.FETCH_TIMEOUT_MILLIS;
    private String userAgent = Constants.DEFAULT_USER_AGENT;
    
    public Path getPositiveWordsPath() {
        return positiveWordsPath;
    }
    
    public void setPositiveWordsPath(Path positiveWordsPath) {
        this.positiveWordsPath = positiveWordsPath;
    }
    
    public Path getNegativeWordsPath() {
        return negativeWordsPath;
    }
    
    public void setNegativeWordsPath(Path negativeWordsPath) {
        this.negativeWordsPath = negativeWordsPath;
    }
    
    public Path getStopWordsPath() {
        return stopWordsPath;
    }
    
    public void setStopWordsPath(Path stopWordsPath) {
        this.stopWordsPath = stopWordsPath;
    }
    
    public List<String> getLexiconCharsets() {
        return lexiconCharsets;
    }
    
    public void setLexiconCharsets(List<String> lexiconCharsets) {
        this.lexiconCharsets = List.copyOf(lexiconCharsets);
    }
    
    public int getMaxTextLength() {
        return maxTextLength;
    }
    
    public void setMaxTextLength(int maxTextLength) {
        this.maxTextLength = maxTextLength;
    }
    
    public int getFetchTimeoutMillis() {
        return fetchTimeoutMillis;
    }
    
    public void setFetchTimeoutMillis(int fetchTimeoutMillis) {
        this.fetchTimeoutMillis = fetchTimeoutMillis;
    }
    
    public String getUserAgent() {
        return userAgent;
    }
    
    public void setUserAgent(String userAgent) {
        this.userAgent = userAgent;
    }
    
    /**
     * 使用默认配置创建实例
     */
    public static EngineConfig defaults() {
        return new EngineConfig();
    }
}
