package com.textmetrics.analysis;

import com.textmetrics.config.Constants;
import com.textmetrics.lexicon.Lexicon;
import com.textmetrics.lexicon.LexiconSet;
import com.textmetrics.scoring.ReadabilityScore;
import com.textmetrics.scoring.ReadabilityScorer;
import com.textmetrics.scoring.SentimentScore;
import com.textmetrics.scoring.SentimentScorer;
import com.textmetrics.text.ComplexWordClassifier;
import com.textmetrics.text.PersonalPronouns;
import com.textmetrics.text.SentenceSplitter;
import com.textmetrics.text.StopWordFilter;
import com.textmetrics.text.SyllableEstimator;
import com.textmetrics.text.TextNormalizer;
import com.textmetrics.text.Token;
import com.textmetrics.text.Tokenizer;
import com.textmetrics.text.WhitespaceTokenizer;
import com.textmetrics.text.WordClassification;

import java.util.List;
import java.util.Objects;
import java.util.Set;

/**
 * 文本指标引擎：将一段文本与三个词表转换为一条 {@link MetricsRecord}。
 *
 * <p>无共享可变状态，可被多个线程并发调用。不做任何 I/O。</p>
 */
public class TextMetricsEngine {
    private final SentenceSplitter sentenceSplitter;
    private final Tokenizer tokenizer;
    private final ComplexWordClassifier complexWordClassifier;
    private final ReadabilityScorer readabilityScorer;
    private final MetricsAggregator aggregator;

    public TextMetricsEngine() {
        this(new WhitespaceTokenizer());
    }

    public TextMetricsEngine(Tokenizer tokenizer) {
        this.sentenceSplitter = new SentenceSplitter();
        this.tokenizer = tokenizer;
        this.complexWordClassifier = new ComplexWordClassifier(Constants.COMPLEX_SYLLABLE_THRESHOLD);
        this.readabilityScorer = new ReadabilityScorer(complexWordClassifier, Constants.FOG_WEIGHT);
        this.aggregator = new MetricsAggregator();
    }

    public MetricsRecord analyze(String text, Set<String> positive, Set<String> negative, Set<String> stopWords) {
        LexiconSet lexicons = new LexiconSet(
            Lexicon.of("positive", positive),
            Lexicon.of("negative", negative),
            Lexicon.of("stopwords", stopWords)
        );
        return analyze(text, lexicons);
    }

    public MetricsRecord analyze(String text, LexiconSet lexicons) {
        Objects.requireNonNull(text, "待分析文本不能为null");
        Objects.requireNonNull(lexicons, "词表不能为null");

        List<String> sentences = sentenceSplitter.split(text);
        List<Token> allTokens = tokenizer.tokenize(TextNormalizer.normalize(text));
        StopWordFilter.FilterResult filtered = new StopWordFilter(lexicons.stopWords().words()).filter(allTokens);

        SentimentScore sentiment = new SentimentScorer(lexicons.positive(), lexicons.negative()).score(filtered.kept());
        ReadabilityScore readability = readabilityScorer.score(sentences, filtered.kept(), allTokens);
        return aggregator.aggregate(sentiment, readability, filtered.stopWordCount());
    }

    /**
     * 计算单个词的派生属性，不做缓存。
     */
    public WordClassification classify(String word, Lexicon stopWords) {
        String normalized = TextNormalizer.normalize(word).trim();
        boolean stopWord = stopWords != null && stopWords.contains(normalized);
        return new WordClassification(
            normalized,
            SyllableEstimator.estimate(normalized),
            complexWordClassifier.isComplex(normalized),
            stopWord,
            PersonalPronouns.isPersonalPronoun(normalized)
        );
    }
}
