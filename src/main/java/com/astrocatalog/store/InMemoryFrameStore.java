package com.astrocatalog.store;

import com.astrocatalog.model.CaptureKind;
import com.astrocatalog.model.DateRange;
import com.astrocatalog.model.Frame;

import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Catálogo en memoria que conserva el orden de inserción.
 */
public class InMemoryFrameStore implements FrameStore {

    private final List<Frame> frames = new CopyOnWriteArrayList<>();
    private final AtomicInteger queryCount = new AtomicInteger();

    public InMemoryFrameStore() {}

    public InMemoryFrameStore(Collection<Frame> initial) {
        frames.addAll(initial);
    }

    public void add(Frame frame) {
        frames.add(frame);
    }

    public void addAll(Collection<Frame> more) {
        frames.addAll(more);
    }

    public void clear() {
        frames.clear();
    }

    public int size() {
        return frames.size();
    }

    public int getQueryCount() {
        return queryCount.get();
    }

    @Override
    public List<Frame> findLightFrames(DateRange range) throws FrameStoreException {
        queryCount.incrementAndGet();
        List<Frame> out = new ArrayList<>();
        for (Frame f : frames) {
            if (f.kind == CaptureKind.LIGHT && inRange(f, range)) out.add(f);
        }
        return out;
    }

    @Override
    public List<Frame> findCalibrationFrames(DateRange range) throws FrameStoreException {
        queryCount.incrementAndGet();
        List<Frame> out = new ArrayList<>();
        for (Frame f : frames) {
            if (!f.kind.isCalibration()) continue;
            if (f.kind == CaptureKind.FLAT && !inRange(f, range)) continue;
            out.add(f);
        }
        return out;
    }

    /**
     * Los frames sin fecha pasan siempre: la detección de sesiones los cuenta como no asignables
     * y la caché como inservibles.
     */
    static boolean inRange(Frame f, DateRange range) {
        return range == null || f.sessionDate == null || range.contains(f.sessionDate);
    }
}
