package com.astrocatalog.service;

import com.astrocatalog.model.AggregationResult;
import com.astrocatalog.model.CalibrationSettings;
import com.astrocatalog.model.DateRange;
import com.astrocatalog.model.Frame;
import com.astrocatalog.store.FrameStore;
import com.astrocatalog.store.FrameStoreException;
import com.astrocatalog.store.InMemoryFrameStore;
import org.junit.After;
import org.junit.Test;

import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;

import static org.junit.Assert.*;

public class AggregationControllerTest {

    private AggregationController controller;

    @After
    public void tearDown() {
        if (controller != null) controller.close();
    }

    /** Registra los callbacks y permite esperar a un número dado de ellos. */
    private static class Recorder implements AggregationListener {
        final List<AggregationResult> completed = new CopyOnWriteArrayList<>();
        final List<FrameStoreException> failed = new CopyOnWriteArrayList<>();
        final CountDownLatch done;

        Recorder(int expected) {
            done = new CountDownLatch(expected);
        }

        @Override
        public void onCompleted(AggregationResult result) {
            completed.add(result);
            done.countDown();
        }

        @Override
        public void onFailed(long runId, FrameStoreException error) {
            failed.add(error);
            done.countDown();
        }

        void await() throws InterruptedException {
            assertTrue("timeout", done.await(5, TimeUnit.SECONDS));
        }
    }

    /** Catálogo que puede fallar o bloquear la primera consulta. */
    private static class ControlledStore implements FrameStore {
        final InMemoryFrameStore delegate = new InMemoryFrameStore();
        final AtomicBoolean fail = new AtomicBoolean();
        final AtomicBoolean blockFirst = new AtomicBoolean();
        final CountDownLatch entered = new CountDownLatch(1);
        final CountDownLatch release = new CountDownLatch(1);
        final AtomicInteger calls = new AtomicInteger();

        @Override
        public List<Frame> findLightFrames(DateRange range) throws FrameStoreException {
            if (calls.getAndIncrement() == 0 && blockFirst.get()) {
                entered.countDown();
                try {
                    release.await(5, TimeUnit.SECONDS);
                } catch (InterruptedException e) {
                    Thread.currentThread().interrupt();
                }
            }
            if (fail.get()) throw new FrameStoreException("catálogo no disponible");
            return delegate.findLightFrames(range);
        }

        @Override
        public List<Frame> findCalibrationFrames(DateRange range) throws FrameStoreException {
            return delegate.findCalibrationFrames(range);
        }
    }

    @Test
    public void testRefreshPublishesResult() throws Exception {
        ControlledStore store = new ControlledStore();
        store.delegate.addAll(Fixtures.lights("l", 3, "M42", "Ha", "CamA", 300.0, -10.0));
        controller = new AggregationController(store, CalibrationSettings::defaults);

        Recorder rec = new Recorder(1);
        AggregationRun run = controller.refresh(rec);
        rec.await();

        assertEquals(1, rec.completed.size());
        assertSame(rec.completed.get(0), controller.getLastResult());
        assertEquals(run.getId(), controller.getLastResult().runId);
        assertTrue(run.await(5, TimeUnit.SECONDS));
        assertEquals(AggregationRun.Outcome.COMPLETED, run.getOutcome());
    }

    @Test
    public void testFailureKeepsPreviousResult() throws Exception {
        ControlledStore store = new ControlledStore();
        store.delegate.addAll(Fixtures.lights("l", 3, "M42", "Ha", "CamA", 300.0, -10.0));
        controller = new AggregationController(store, CalibrationSettings::defaults);

        Recorder first = new Recorder(1);
        controller.refresh(first);
        first.await();
        AggregationResult previous = controller.getLastResult();

        store.fail.set(true);
        Recorder second = new Recorder(1);
        AggregationRun run = controller.refresh(second);
        second.await();

        assertEquals(1, second.failed.size());
        assertTrue(second.completed.isEmpty());
        assertSame(previous, controller.getLastResult());
        assertTrue(run.await(5, TimeUnit.SECONDS));
        assertEquals(AggregationRun.Outcome.FAILED, run.getOutcome());
    }

    @Test
    public void testSupersededRunIsDiscarded() throws Exception {
        ControlledStore store = new ControlledStore();
        store.blockFirst.set(true);
        store.delegate.addAll(Fixtures.lights("l", 3, "M42", "Ha", "CamA", 300.0, -10.0));
        controller = new AggregationController(store, CalibrationSettings::defaults);

        Recorder rec = new Recorder(1);
        AggregationRun first = controller.refresh(rec);
        assertTrue(store.entered.await(5, TimeUnit.SECONDS));

        AggregationRun second = controller.refresh(rec);
        assertTrue(first.isCancelled());
        store.release.countDown();
        rec.await();

        assertTrue(first.await(5, TimeUnit.SECONDS));
        assertEquals(AggregationRun.Outcome.CANCELLED, first.getOutcome());
        assertEquals(1, rec.completed.size());
        assertEquals(second.getId(), rec.completed.get(0).runId);
        assertEquals(second.getId(), controller.getLastResult().runId);
        assertSame(second, controller.getCurrentRun());
    }

    @Test
    public void testSettingsReadAtRefresh() throws Exception {
        ControlledStore store = new ControlledStore();
        store.delegate.addAll(Fixtures.lights("l", 3, "M42", "Ha", "CamA", 300.0, -10.0));
        store.delegate.addAll(Fixtures.bias("b", 5, -10.0, "CamA"));
        AtomicInteger recommended = new AtomicInteger(20);
        controller = new AggregationController(store,
                () -> new CalibrationSettings(1.0, 1.0, 3.0, 0.1, recommended.get(), 5, true, true));

        Recorder first = new Recorder(1);
        controller.refresh(first);
        first.await();
        assertEquals(25, first.completed.get(0).sessions.get(0).bias().qualityScore());

        recommended.set(10);
        Recorder second = new Recorder(1);
        controller.refresh(second);
        second.await();
        assertEquals(50, second.completed.get(0).sessions.get(0).bias().qualityScore());
    }

    @Test
    public void testListenerErrorDoesNotChangeOutcome() throws Exception {
        ControlledStore store = new ControlledStore();
        store.delegate.addAll(Fixtures.lights("l", 3, "M42", "Ha", "CamA", 300.0, -10.0));
        controller = new AggregationController(store, CalibrationSettings::defaults);

        Recorder throwing = new Recorder(1) {
            @Override
            public void onCompleted(AggregationResult result) {
                super.onCompleted(result);
                throw new IllegalStateException("fallo en la vista");
            }
        };
        AggregationRun run = controller.refresh(throwing);
        throwing.await();

        // La siguiente agregación va detrás en el mismo hilo
        Recorder next = new Recorder(1);
        controller.refresh(next);
        next.await();

        assertTrue(run.await(5, TimeUnit.SECONDS));
        assertEquals(AggregationRun.Outcome.COMPLETED, run.getOutcome());
        assertEquals(1, throwing.completed.size());
        assertTrue(throwing.failed.isEmpty());
        assertEquals(1, next.completed.size());
    }

    @Test
    public void testCancelledRunThatFailsIsCancelled() throws Exception {
        ControlledStore store = new ControlledStore();
        store.blockFirst.set(true);
        controller = new AggregationController(store, CalibrationSettings::defaults);

        Recorder rec = new Recorder(1);
        AggregationRun run = controller.refresh(rec);
        assertTrue(store.entered.await(5, TimeUnit.SECONDS));
        controller.cancel();
        store.fail.set(true);
        store.release.countDown();

        assertTrue(run.await(5, TimeUnit.SECONDS));
        assertEquals(AggregationRun.Outcome.CANCELLED, run.getOutcome());

        Recorder next = new Recorder(1);
        controller.refresh(next);
        next.await();
        assertEquals(1, next.failed.size());
        assertTrue(rec.failed.isEmpty());
        assertTrue(rec.completed.isEmpty());
    }

    @Test
    public void testPreviousResultKeptAcrossControllers() throws Exception {
        ControlledStore first = new ControlledStore();
        first.delegate.addAll(Fixtures.lights("l", 3, "M42", "Ha", "CamA", 300.0, -10.0));
        controller = new AggregationController(first, CalibrationSettings::defaults);
        Recorder ok = new Recorder(1);
        controller.refresh(ok);
        ok.await();
        AggregationResult previous = controller.getLastResult();
        controller.close();

        ControlledStore other = new ControlledStore();
        other.fail.set(true);
        controller = new AggregationController(other, CalibrationSettings::defaults, previous);
        assertSame(previous, controller.getLastResult());

        Recorder failing = new Recorder(1);
        controller.refresh(failing);
        failing.await();

        assertEquals(1, failing.failed.size());
        assertSame(previous, controller.getLastResult());
    }

    @Test
    public void testCancelWithoutRunIsHarmless() {
        controller = new AggregationController(new InMemoryFrameStore(), CalibrationSettings::defaults);
        controller.cancel();
        assertNull(controller.getCurrentRun());
        assertNull(controller.getLastResult());
    }
}
