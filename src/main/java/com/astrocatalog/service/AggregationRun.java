package com.astrocatalog.service;

import java.util.concurrent.CancellationException;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Manejador de una agregación en curso: permite cancelarla (de forma cooperativa, entre sesiones)
 * y esperar a que termine.
 */
public final class AggregationRun {

    public enum Outcome { RUNNING, COMPLETED, FAILED, CANCELLED }

    private final long id;
    private final AtomicBoolean cancelled = new AtomicBoolean(false);
    private final CountDownLatch done = new CountDownLatch(1);
    private volatile Outcome outcome = Outcome.RUNNING;

    public AggregationRun(long id) {
        this.id = id;
    }

    public long getId() {
        return id;
    }

    public void cancel() {
        cancelled.set(true);
    }

    public boolean isCancelled() {
        return cancelled.get();
    }

    void checkCancelled() {
        if (cancelled.get()) throw new CancellationException("Agregación " + id + " cancelada");
    }

    void finish(Outcome result) {
        this.outcome = result;
        done.countDown();
    }

    public Outcome getOutcome() {
        return outcome;
    }

    public boolean isDone() {
        return done.getCount() == 0;
    }

    public boolean await(long timeout, TimeUnit unit) throws InterruptedException {
        return done.await(timeout, unit);
    }
}
