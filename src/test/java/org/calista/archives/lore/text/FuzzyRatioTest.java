package org.calista.archives.lore.text;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

public class FuzzyRatioTest {

    @Test
    void identicalStringsScoreFullMarks() {
        assertEquals(100, FuzzyRatio.ratio("zeloria", "zeloria"));
        assertEquals(100, FuzzyRatio.partialRatio("zeloria", "zeloria"));
    }

    @Test
    void emptyInputScoresZero() {
        assertEquals(0, FuzzyRatio.ratio("", "mage"));
        assertEquals(0, FuzzyRatio.ratio("mage", ""));
        assertEquals(0, FuzzyRatio.partialRatio("", ""));
        assertEquals(0, FuzzyRatio.partialRatio(null, "mage"));
    }

    @Test
    void ratioIsCommonSubsequenceShare() {
        // LCS("abcd", "abce") = 3 -> 2*3 / 8
        assertEquals(75, FuzzyRatio.ratio("abcd", "abce"));
        assertEquals(0, FuzzyRatio.ratio("abc", "xyz"));
    }

    @Test
    void partialRatioFindsSubstring() {
        assertEquals(100, FuzzyRatio.partialRatio("mage", "a wandering mage"));
        assertEquals(100, FuzzyRatio.partialRatio("a wandering mage", "mage"));
    }

    @Test
    void partialRatioUsesBestWindow() {
        // best window of "xxabd" is "abd", sharing 2 of 3 characters with "abc"
        assertEquals(67, FuzzyRatio.partialRatio("abc", "xxabd"));
        assertEquals(67, FuzzyRatio.partialRatio("xxabd", "abc"));
    }

    @Test
    void scoresStayInRange() {
        String[] samples = {"a", "mage", "the capital city", "zzzz", "aldric the wise"};
        for (String a : samples) {
            for (String b : samples) {
                int r = FuzzyRatio.ratio(a, b);
                int p = FuzzyRatio.partialRatio(a, b);
                assertTrue(r >= 0 && r <= 100, a + "/" + b);
                assertTrue(p >= 0 && p <= 100, a + "/" + b);
            }
        }
    }
}
