package com.textmetrics.text;

import com.textmetrics.config.Constants;

import java.util.List;
import java.util.Locale;

/**
 * 复杂词判定：去除 -es/-ed/-ing 屈折后缀后音节数不少于阈值。
 */
public class ComplexWordClassifier {

    private static final List<String> INFLECTIONAL_SUFFIXES = List.of("es", "ed", "ing");

    private final int syllableThreshold;

    public ComplexWordClassifier() {
        this(Constants.COMPLEX_SYLLABLE_THRESHOLD);
    }

    public ComplexWordClassifier(int syllableThreshold) {
        this.syllableThreshold = Math.max(1, syllableThreshold);
    }

    public boolean isComplex(String word) {
        if (word == null || word.isEmpty()) {
            return false;
        }
        return SyllableEstimator.estimate(stripInflectionalSuffix(word)) >= syllableThreshold;
    }

    /**
     * 去掉末尾的屈折后缀；单词不长于后缀时原样返回。
     */
    static String stripInflectionalSuffix(String word) {
        String lowerWord = word.toLowerCase(Locale.ROOT);
        for (String suffix : INFLECTIONAL_SUFFIXES) {
            if (lowerWord.length() > suffix.length() && lowerWord.endsWith(suffix)) {
                return lowerWord.substring(0, lowerWord.length() - suffix.length());
            }
        }
        return lowerWord;
    }
}
