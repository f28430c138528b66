package com.textmetrics.scoring;

import com.textmetrics.config.Constants;
import com.textmetrics.text.ComplexWordClassifier;
import com.textmetrics.text.PersonalPronouns;
import com.textmetrics.text.SyllableEstimator;
import com.textmetrics.text.Token;

import java.util.List;

/**
 * Gunning-Fog 可读性评分及其辅助统计量。
 *
 * <p>词数、复杂词、字符与音节均基于去除停用词后的内容词；人称代词基于原始词流，
 * 因为代词通常也是停用词。</p>
 */
public class ReadabilityScorer {
    private final ComplexWordClassifier complexWordClassifier;
    private final double fogWeight;

    public ReadabilityScorer() {
        this(new ComplexWordClassifier(Constants.COMPLEX_SYLLABLE_THRESHOLD), Constants.FOG_WEIGHT);
    }

    public ReadabilityScorer(ComplexWordClassifier complexWordClassifier, double fogWeight) {
        this.complexWordClassifier = complexWordClassifier;
        this.fogWeight = fogWeight;
    }

    public ReadabilityScore score(List<String> sentences, List<Token> contentTokens, List<Token> allTokens) {
        int sentenceCount = sentences == null ? 0 : sentences.size();
        List<Token> words = contentTokens == null ? List.of() : contentTokens;

        int complexWordCount = 0;
        int syllableCount = 0;
        int characterCount = 0;
        for (Token token : words) {
            String term = token.term();
            if (complexWordClassifier.isComplex(term)) {
                complexWordCount++;
            }
            syllableCount += SyllableEstimator.estimate(term);
            characterCount += term.length();
        }

        int wordCount = words.size();
        double averageSentenceLength = Ratios.safeDivide(wordCount, Math.max(sentenceCount, 1));
        double percentageComplexWords = Ratios.safeDivide(complexWordCount, wordCount) * 100.0;
        double fogIndex = fogWeight * (averageSentenceLength + percentageComplexWords);

        return new ReadabilityScore(
            sentenceCount,
            wordCount,
            complexWordCount,
            syllableCount,
            characterCount,
            countPersonalPronouns(allTokens),
            averageSentenceLength,
            percentageComplexWords,
            fogIndex,
            Ratios.safeDivide(characterCount, wordCount),
            Ratios.safeDivide(syllableCount, wordCount)
        );
    }

    static int countPersonalPronouns(List<Token> tokens) {
        if (tokens == null) {
            return 0;
        }
        int count = 0;
        for (Token token : tokens) {
            if (PersonalPronouns.isPersonalPronoun(token.term())) {
                count++;
            }
        }
        return count;
    }
}
