package com.astrocatalog.model;

import org.junit.Test;

import static org.junit.Assert.*;

public class QualityScoreTest {

    @Test
    public void testAnchors() {
        assertEquals(0, QualityScore.of(0, 20));
        assertEquals(50, QualityScore.of(10, 20));
        assertEquals(100, QualityScore.of(20, 20));
        assertEquals(40, QualityScore.of(8, 20));
    }

    @Test
    public void testSaturatesAtHundred() {
        assertEquals(100, QualityScore.of(21, 20));
        assertEquals(100, QualityScore.of(500, 20));
    }

    @Test
    public void testMonotonic() {
        int previous = -1;
        for (int n = 0; n <= 60; n++) {
            int score = QualityScore.of(n, 20);
            assertTrue("score(" + n + ") < score(" + (n - 1) + ")", score >= previous);
            assertTrue(score >= 0 && score <= 100);
            previous = score;
        }
    }

    @Test
    public void testRounding() {
        // 1/20 = 5%, 3/20 = 15%, 1/30 = 3.33%
        assertEquals(5, QualityScore.of(1, 20));
        assertEquals(15, QualityScore.of(3, 20));
        assertEquals(3, QualityScore.of(1, 30));
        assertEquals(7, QualityScore.of(2, 30));
    }
}
