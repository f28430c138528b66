package com.textmetrics.analysis;

import com.textmetrics.lexicon.Lexicon;
import com.textmetrics.lexicon.LexiconLoader;
import com.textmetrics.lexicon.LexiconSet;
import com.textmetrics.config.EngineConfig;
import com.textmetrics.text.WordClassification;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

import java.util.List;
import java.util.Set;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.ArrayList;

import static org.junit.jupiter.api.Assertions.*;

/**
 * 文本指标引擎测试
 *
 * 覆盖典型场景、空输入、停用词与不变式
 */
class TextMetricsEngineTest {

    private static final double TOLERANCE = 1e-5;

    private static final Set<String> POSITIVE = Set.of("love", "amazing", "wonderful");
    private static final Set<String> STOP_WORDS = Set.of("i", "this", "it", "is", "and");

    private final TextMetricsEngine engine = new TextMetricsEngine();

    @Test
    @DisplayName("典型场景：正面评价")
    void testPositiveReviewScenario() {
        MetricsRecord metrics = engine.analyze("I love this product. It is amazing and wonderful!",
            POSITIVE, Set.of(), STOP_WORDS);

        assertEquals(3, metrics.positiveScore());
        assertEquals(0, metrics.negativeScore());
        assertEquals(1.0, metrics.polarityScore(), TOLERANCE);
        assertEquals(0.75, metrics.subjectivityScore(), TOLERANCE);
        assertEquals(2, metrics.personalPronounCount());
        assertEquals(2, metrics.sentenceCount());
        assertEquals(4, metrics.wordCount());
        assertEquals(5, metrics.stopWordCount());
        assertEquals(1, metrics.complexWordCount());
        assertEquals(2.0, metrics.averageSentenceLength(), TOLERANCE);
        assertEquals(25.0, metrics.percentageComplexWords(), TOLERANCE);
        assertEquals(10.8, metrics.fogIndex(), TOLERANCE);
        assertEquals(6.75, metrics.averageWordLength(), TOLERANCE);
        assertEquals(2.25, metrics.syllablesPerWord(), TOLERANCE);
        assertEquals(SentimentLabel.POSITIVE, metrics.sentimentLabel());
    }

    @Test
    @DisplayName("空文本：所有指标为 0")
    void testEmptyText() {
        MetricsRecord metrics = engine.analyze("", POSITIVE, Set.of("bad"), STOP_WORDS);

        assertEquals(0, metrics.wordCount());
        assertEquals(0, metrics.sentenceCount());
        assertEquals(0.0, metrics.polarityScore());
        assertEquals(0.0, metrics.subjectivityScore());
        assertEquals(0.0, metrics.fogIndex());
        assertEquals(0.0, metrics.averageSentenceLength());
        assertEquals(0.0, metrics.averageWordLength());
        assertEquals(0.0, metrics.syllablesPerWord());
        assertEquals(SentimentLabel.NEUTRAL, metrics.sentimentLabel());
    }

    @Test
    @DisplayName("全部为停用词时比值为 0，代词仍按原始词流统计")
    void testOnlyStopWords() {
        MetricsRecord metrics = engine.analyze("It is. And this!", POSITIVE, Set.of(), STOP_WORDS);

        assertEquals(0, metrics.wordCount());
        assertEquals(4, metrics.stopWordCount());
        assertEquals(1, metrics.personalPronounCount());
        assertEquals(0.0, metrics.fogIndex());
        assertEquals(0.0, metrics.percentageComplexWords());
    }

    @Test
    @DisplayName("空词表：极性与主观性为 0")
    void testEmptyLexicons() {
        MetricsRecord metrics = engine.analyze("Terrible service but wonderful food.", Set.of(), Set.of(), Set.of());

        assertEquals(0.0, metrics.polarityScore());
        assertEquals(0.0, metrics.subjectivityScore());
        assertEquals(5, metrics.wordCount());
        assertEquals(0, metrics.stopWordCount());
    }

    @Test
    @DisplayName("负面文本标签为 NEGATIVE")
    void testNegativeText() {
        MetricsRecord metrics = engine.analyze("The delivery was terrible and the box was broken.",
            Set.of("good"), Set.of("terrible", "broken"), Set.of("the", "was", "and"));

        assertEquals(2, metrics.negativeScore());
        assertTrue(metrics.polarityScore() < 0);
        assertEquals(SentimentLabel.NEGATIVE, metrics.sentimentLabel());
    }

    @Test
    @DisplayName("大写的词表项同样生效")
    void testUpperCaseLexiconEntries() {
        MetricsRecord metrics = engine.analyze("Great job", Set.of("GREAT"), Set.of(), Set.of("JOB"));

        assertEquals(1, metrics.positiveScore());
        assertEquals(1, metrics.stopWordCount());
    }

    @Test
    @DisplayName("相同输入两次调用结果完全一致")
    void testIdempotence() {
        String text = "Sophisticated readers appreciate wonderful, carefully created documentation. Don't they?";

        MetricsRecord first = engine.analyze(text, POSITIVE, Set.of("careless"), STOP_WORDS);
        MetricsRecord second = engine.analyze(text, POSITIVE, Set.of("careless"), STOP_WORDS);

        assertEquals(first, second);
    }

    @ParameterizedTest
    @ValueSource(strings = {
        "",
        "   ",
        "...!!!???",
        "a",
        "I I I I I",
        "Love hate love hate. Wonderful? Awful!",
        "Notwithstanding extraordinarily complicated institutional responsibilities, "
            + "administrators communicated unsatisfactorily.",
        "no punctuation at all just words flowing on and on"
    })
    @DisplayName("任意文本满足数值不变式")
    void testInvariants(String text) {
        MetricsRecord metrics = engine.analyze(text,
            Set.of("love", "wonderful"), Set.of("hate", "awful", "love"), STOP_WORDS);

        assertTrue(metrics.wordCount() >= 0);
        assertTrue(metrics.complexWordCount() <= metrics.wordCount());
        assertTrue(metrics.polarityScore() >= -1.0 && metrics.polarityScore() <= 1.0);
        assertTrue(metrics.subjectivityScore() >= 0.0 && metrics.subjectivityScore() <= 1.0);
        assertTrue(metrics.fogIndex() >= 0.0);
        assertFalse(Double.isNaN(metrics.averageWordLength()));
        assertFalse(Double.isNaN(metrics.syllablesPerWord()));
    }

    @Test
    @DisplayName("null 文本抛出 NullPointerException")
    void testNullText() {
        assertThrows(NullPointerException.class, () -> engine.analyze(null, Set.of(), Set.of(), Set.of()));
    }

    @Test
    @DisplayName("使用内置词表分析")
    void testAnalyzeWithBundledLexicons() {
        LexiconSet lexicons = new LexiconLoader().loadDefaults(EngineConfig.defaults());

        MetricsRecord metrics = engine.analyze("I love this product. It is amazing and wonderful!", lexicons);

        assertEquals(3, metrics.positiveScore());
        assertEquals(2, metrics.personalPronounCount());
        assertEquals(SentimentLabel.POSITIVE, metrics.sentimentLabel());
    }

    @Test
    @DisplayName("并发调用互不干扰")
    void testConcurrentCalls() throws Exception {
        String text = "I love this product. It is amazing and wonderful!";
        MetricsRecord expected = engine.analyze(text, POSITIVE, Set.of(), STOP_WORDS);

        ExecutorService executor = Executors.newFixedThreadPool(4);
        try {
            List<Future<MetricsRecord>> futures = new ArrayList<>();
            for (int i = 0; i < 32; i++) {
                futures.add(executor.submit(() -> engine.analyze(text, POSITIVE, Set.of(), STOP_WORDS)));
            }
            for (Future<MetricsRecord> future : futures) {
                assertEquals(expected, future.get(10, TimeUnit.SECONDS));
            }
        } finally {
            executor.shutdownNow();
        }
    }

    @Test
    @DisplayName("单词分类")
    void testClassify() {
        Lexicon stopWords = Lexicon.of("stopwords", STOP_WORDS);

        WordClassification sophisticated = engine.classify("Sophisticated,", stopWords);
        WordClassification it = engine.classify("It", stopWords);
        WordClassification created = engine.classify("created", stopWords);

        assertEquals("sophisticated", sophisticated.word());
        assertEquals(5, sophisticated.syllables());
        assertTrue(sophisticated.complex());
        assertFalse(sophisticated.stopWord());

        assertTrue(it.stopWord());
        assertTrue(it.personalPronoun());

        assertFalse(created.complex());
    }
}
