package com.astrocatalog.model;

import org.junit.Test;

import static org.junit.Assert.*;

public class CalibrationMatchResultTest {

    private final CalibrationSettings settings = CalibrationSettings.defaults();

    private CalibrationMatchResult result(int frames, int masters) {
        return new CalibrationMatchResult(CalibrationType.DARK, frames, masters, null, settings);
    }

    @Test
    public void testScoreIgnoresMasters() {
        assertEquals(0, result(0, 1).qualityScore());
        assertTrue(result(0, 1).hasMaster());
        assertEquals(40, result(8, 0).qualityScore());
        assertEquals(40, result(8, 2).qualityScore());
    }

    @Test
    public void testSatisfied() {
        assertFalse(result(9, 0).isSatisfied());
        assertTrue(result(10, 0).isSatisfied());
        assertTrue(result(0, 1).isSatisfied());
        assertTrue(result(0, 0).isEmpty());
        assertFalse(result(0, 1).isEmpty());
    }

    @Test
    public void testDisplayText() {
        assertEquals("✗ Missing", result(0, 0).displayText());
        assertEquals("⚠ 8 frames (need 10+)", result(8, 0).displayText());
        assertEquals("✓ 12 frames", result(12, 0).displayText());
        assertEquals("✓ 3 + 1 Master", result(3, 1).displayText());
    }

    @Test
    public void testMissingToRecommended() {
        assertEquals(12, result(8, 0).missingToRecommended());
        assertEquals(0, result(25, 0).missingToRecommended());
    }

    @Test(expected = IllegalArgumentException.class)
    public void testNegativeCount() {
        result(-1, 0);
    }
}
