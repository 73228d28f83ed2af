package com.astrocatalog.service;

import com.astrocatalog.model.CalibrationMatchResult;
import com.astrocatalog.model.CalibrationSettings;
import com.astrocatalog.model.CalibrationType;
import com.astrocatalog.model.Session;
import com.astrocatalog.model.SessionStatus;
import org.junit.Test;

import java.util.List;

import static org.junit.Assert.*;

public class RecommendationGeneratorTest {

    private final CalibrationSettings settings = CalibrationSettings.defaults();
    private final RecommendationGenerator generator = new RecommendationGenerator(settings);
    private final SessionStatusClassifier classifier = new SessionStatusClassifier();

    private final Session session = new Session(Fixtures.NIGHT, "M42", "Ha", "CamA", 30, 300.0, -10.2, 1, 1, false);

    private CalibrationMatchResult r(CalibrationType t, int frames, int masters) {
        return new CalibrationMatchResult(t, frames, masters, frames + masters > 0 ? -10.0 : null, settings);
    }

    private List<String> generate(Session s, CalibrationMatchResult d, CalibrationMatchResult b, CalibrationMatchResult f) {
        return generator.generate(s, classifier.classify(d, b, f), d, b, f);
    }

    @Test
    public void testPartialSessionGetsCaptureInstructions() {
        List<String> recs = generate(session, r(CalibrationType.DARK, 20, 0), r(CalibrationType.BIAS, 8, 0),
                r(CalibrationType.FLAT, 0, 0));

        assertEquals(2, recs.size());
        assertEquals("Capture 12 more bias frames at ~-10°C, 1x1 binning "
                + "(currently 8, minimum 10, recommended 20+) with CamA", recs.get(0));
        assertEquals("Capture 20 more flat frames at Ha filter, night of 2024-01-15, ~-10°C, 1x1 binning "
                + "(currently 0, minimum 10, recommended 20+) with CamA", recs.get(1));
    }

    @Test
    public void testDarkInstructionCarriesExposure() {
        List<String> recs = generate(session, r(CalibrationType.DARK, 5, 0), r(CalibrationType.BIAS, 20, 0),
                r(CalibrationType.FLAT, 20, 0));

        assertEquals(1, recs.size());
        assertTrue(recs.get(0), recs.get(0).startsWith("Capture 15 more dark frames at ~300.0s, ~-10°C, 1x1 binning"));
    }

    @Test
    public void testUnknownValuesWithoutInstrument() {
        Session s = new Session(Fixtures.NIGHT, null, null, null, 3, null, null, 2, 2, false);
        List<String> recs = generate(s, r(CalibrationType.DARK, 0, 0), r(CalibrationType.BIAS, 0, 0),
                r(CalibrationType.FLAT, 0, 0));

        assertEquals(3, recs.size());
        assertEquals("Capture 20 more dark frames at unknown exposure, unknown temperature, 2x2 binning "
                + "(currently 0, minimum 10, recommended 20+)", recs.get(0));
        assertTrue(recs.get(2).contains("No Filter filter"));
    }

    @Test
    public void testCompleteSessionSuggestsTopUp() {
        List<String> recs = generate(session, r(CalibrationType.DARK, 20, 0), r(CalibrationType.BIAS, 12, 0),
                r(CalibrationType.FLAT, 25, 0));

        assertEquals(2, recs.size());
        assertEquals(RecommendationGenerator.ALL_PRESENT, recs.get(0));
        assertEquals("Consider adding 8 more bias frames (currently 12, recommended 20+)", recs.get(1));
    }

    @Test
    public void testFullyCalibratedSessionOnlyConfirms() {
        List<String> recs = generate(session, r(CalibrationType.DARK, 20, 0), r(CalibrationType.BIAS, 30, 0),
                r(CalibrationType.FLAT, 20, 0));
        assertEquals(List.of(RecommendationGenerator.ALL_PRESENT), recs);
    }

    @Test
    public void testMastersSkipInstructions() {
        List<String> recs = generate(session, r(CalibrationType.DARK, 0, 1), r(CalibrationType.BIAS, 15, 0),
                r(CalibrationType.FLAT, 0, 2));

        assertEquals(2, recs.size());
        assertEquals(RecommendationGenerator.MASTERS_PRESENT, recs.get(0));
        assertTrue(recs.get(1).startsWith("Consider adding 5 more bias frames"));
    }
}
