package com.textmetrics.config;

import java.util.List;

/**
 * 全局常量定义
 * 
 * 包含评分参数、输入上限、网页抓取参数与词表资源位置
 */
public final class Constants {
    private Constants() {
        // 工具类，禁止实例化
    }
    
    // ==================== 评分参数 ====================
    /** 极性与主观性公式分母中的平滑项，避免除零 */
    public static final double SCORE_EPSILON = 1e-6;
    /** Gunning-Fog 公式系数 */
    public static final double FOG_WEIGHT = 0.4;
    /** 复杂词音节阈值 */
    public static final int COMPLEX_SYLLABLE_THRESHOLD = 3;
    
    // ==================== 输入参数 ====================
    /** 单次分析允许的最大字符数 */
    public static final int MAX_TEXT_LENGTH = 1_000_000;
    
    // ==================== 网页抓取参数 ====================
    /** 抓取超时（毫秒） */
    public static final int FETCH_TIMEOUT_MILLIS = 10_000;
    /** 抓取时使用的浏览器 User-Agent */
    public static final String DEFAULT_USER_AGENT =
        "Mozilla/5.0 (Windows NT 10.0; Win64; x64) AppleWebKit/537.36 (KHTML, like Gecko) "
            + "Chrome/91.0.4472.124 Safari/537.36";
    
    // ==================== 词表参数 ====================
    /** 内置正面词表 */
    public static final String POSITIVE_WORDS_RESOURCE = "lexicons/positive-words.txt";
    /** 内置负面词表 */
    public static final String NEGATIVE_WORDS_RESOURCE = "lexicons/negative-words.txt";
    /** 内置停用词表 */
    public static final String STOP_WORDS_RESOURCE = "lexicons/stopwords.txt";
    /** 词表解码顺序，首个成功者生效 */
    public static final List<String> LEXICON_CHARSETS = List.of("UTF-8", "ISO-8859-1");
}
