package com.buhmwoo.docsearch.modules.search.application.ranking;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class FuzzyMatcherTest {

    private final FuzzyMatcher matcher = new FuzzyMatcher();
    private final FuzzySettings settings = FuzzySettings.defaults();

    @Test
    void distanceCountsInsertDeleteAndSubstitute() {
        assertEquals(3, matcher.distance("kitten", "sitting"));
        assertEquals(0, matcher.distance("mall", "mall"));
        assertEquals(4, matcher.distance("", "mall"));
        assertEquals(1, matcher.distance("shopping", "shoping"));
    }

    @Test
    void similarityIsSymmetricAndOneForIdenticalStrings() {
        assertEquals(1.0, matcher.similarity("mall", "mall"));
        assertEquals(1.0, matcher.similarity("", ""));
        assertEquals(matcher.similarity("kitten", "sitting"), matcher.similarity("sitting", "kitten"));
        assertEquals(matcher.match("mall", "malls", settings), matcher.match("malls", "mall", settings));
    }

    @Test
    void typoAboveThresholdMatches() {
        assertEquals(7.0 / 8.0, matcher.match("shopping", "shoping", settings), 1e-9);
        assertEquals(0.8, matcher.match("mall", "malls", settings), 1e-9);
    }

    @Test
    void shortTermsUseStricterThreshold() {
        // 2/3 = 0.67 < 0.8
        assertEquals(0.0, matcher.match("cat", "car", settings));
        assertEquals(0.8, matcher.thresholdFor("cat", false, settings));
        assertEquals(0.75, matcher.thresholdFor("catalog", false, settings));
    }

    @Test
    void lengthGapBeyondLimitNeverMatches() {
        assertEquals(0.0, matcher.match("shop", "shopping", settings));
        assertEquals(0.0, matcher.match("mall", "", settings));
        assertEquals(0.0, matcher.match(null, "mall", settings));
    }

    @Test
    void thaiToneMarksAndVowelLengthAreIgnored() {
        // ร้าน(가게) 와 성조 부호가 빠진 오타 ราน
        assertEquals(1.0, matcher.match("ร้าน", "ราน", settings), 1e-9);
        assertEquals(settings.thaiThreshold(), matcher.thresholdFor("ร้าน", true, settings));
    }

    @Test
    void unrelatedWordsDoNotMatch() {
        assertEquals(0.0, matcher.match("mall", "store", settings));
        assertEquals(0.0, matcher.match("weather", "whether", FuzzySettings.defaults().toBuilder().threshold(0.9).build()));
    }
}
