package com.astrocatalog.store;

import com.astrocatalog.model.DateRange;
import com.astrocatalog.model.Frame;
import org.junit.Test;

import java.time.LocalDate;
import java.util.List;

import static org.junit.Assert.*;

public class InMemoryFrameStoreTest {

    private static final LocalDate JAN_10 = LocalDate.of(2024, 1, 10);
    private static final LocalDate JAN_20 = LocalDate.of(2024, 1, 20);

    private InMemoryFrameStore store() {
        return new InMemoryFrameStore(List.of(
                Frame.light("l1").object("M42").date(JAN_10).build(),
                Frame.light("l2").object("M42").date(JAN_20).build(),
                Frame.light("l3").object("M42").build(),
                Frame.dark("d1").exposure(300.0).temperature(-10.0).build(),
                Frame.bias("b1").temperature(-10.0).build(),
                Frame.flat("f1").filter("Ha").date(JAN_10).temperature(-10.0).build(),
                Frame.flat("f2").filter("Ha").date(JAN_20).temperature(-10.0).build()));
    }

    @Test
    public void testUnboundedRangeReturnsEverything() throws Exception {
        InMemoryFrameStore store = store();
        assertEquals(3, store.findLightFrames(DateRange.ALL).size());
        assertEquals(4, store.findCalibrationFrames(DateRange.ALL).size());
        assertEquals(2, store.getQueryCount());
    }

    @Test
    public void testRangeFiltersLightsAndFlatsOnly() throws Exception {
        InMemoryFrameStore store = store();
        DateRange range = new DateRange(JAN_20, null);

        List<Frame> lights = store.findLightFrames(range);
        assertEquals(2, lights.size());
        assertEquals("l2", lights.get(0).id);
        // sin fecha: se devuelve para que la detección lo cuente
        assertEquals("l3", lights.get(1).id);

        List<Frame> calibration = store.findCalibrationFrames(range);
        assertEquals(3, calibration.size());
        for (Frame f : calibration) assertNotEquals("f1", f.id);
    }

    @Test
    public void testUndatedFlatsPassBoundedRange() throws Exception {
        InMemoryFrameStore store = new InMemoryFrameStore(List.of(
                Frame.flat("f0").filter("Ha").temperature(-10.0).build(),
                Frame.flat("f1").filter("Ha").date(JAN_10).temperature(-10.0).build()));

        List<Frame> calibration = store.findCalibrationFrames(new DateRange(JAN_20, JAN_20));
        assertEquals(1, calibration.size());
        assertEquals("f0", calibration.get(0).id);
    }

    @Test
    public void testInsertionOrderKept() throws Exception {
        InMemoryFrameStore store = store();
        List<Frame> calibration = store.findCalibrationFrames(DateRange.ALL);
        assertEquals("d1", calibration.get(0).id);
        assertEquals("f2", calibration.get(3).id);
        store.clear();
        assertEquals(0, store.size());
    }
}
