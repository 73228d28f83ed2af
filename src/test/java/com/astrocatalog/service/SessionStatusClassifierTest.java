package com.astrocatalog.service;

import com.astrocatalog.model.CalibrationMatchResult;
import com.astrocatalog.model.CalibrationSettings;
import com.astrocatalog.model.CalibrationType;
import com.astrocatalog.model.SessionStatus;
import org.junit.Test;

import static org.junit.Assert.*;

public class SessionStatusClassifierTest {

    private final SessionStatusClassifier classifier = new SessionStatusClassifier();
    private final CalibrationSettings settings = CalibrationSettings.defaults();

    private CalibrationMatchResult r(CalibrationType t, int frames, int masters) {
        return new CalibrationMatchResult(t, frames, masters, frames + masters > 0 ? -10.0 : null, settings);
    }

    private SessionStatus classify(int darks, int bias, int flats) {
        return classifier.classify(r(CalibrationType.DARK, darks, 0), r(CalibrationType.BIAS, bias, 0),
                r(CalibrationType.FLAT, flats, 0));
    }

    @Test
    public void testNothingMatchedIsMissing() {
        assertEquals(SessionStatus.MISSING, classify(0, 0, 0));
    }

    @Test
    public void testAcceptableFloorIsInclusive() {
        assertEquals(SessionStatus.COMPLETE, classify(10, 10, 10));
        assertEquals(SessionStatus.PARTIAL, classify(10, 9, 10));
    }

    @Test
    public void testAnyShortfallIsPartial() {
        assertEquals(SessionStatus.PARTIAL, classify(20, 8, 0));
        assertEquals(SessionStatus.PARTIAL, classify(1, 0, 0));
    }

    @Test
    public void testMasterSatisfiesType() {
        SessionStatus s = classifier.classify(r(CalibrationType.DARK, 0, 1), r(CalibrationType.BIAS, 12, 0),
                r(CalibrationType.FLAT, 25, 0));
        assertEquals(SessionStatus.COMPLETE_WITH_MASTERS, s);
        assertTrue(s.isComplete());
    }

    @Test
    public void testMasterWithShortfallElsewhereIsPartial() {
        SessionStatus s = classifier.classify(r(CalibrationType.DARK, 0, 1), r(CalibrationType.BIAS, 3, 0),
                r(CalibrationType.FLAT, 25, 0));
        assertEquals(SessionStatus.PARTIAL, s);
    }
}
