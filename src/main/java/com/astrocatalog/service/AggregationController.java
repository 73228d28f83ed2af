package com.astrocatalog.service;

import com.astrocatalog.model.AggregationResult;
import com.astrocatalog.model.CalibrationSettings;
import com.astrocatalog.model.DateRange;
import com.astrocatalog.store.FrameStore;
import com.astrocatalog.store.FrameStoreException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Objects;
import java.util.concurrent.CancellationException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicLong;
import java.util.function.Supplier;

/**
 * Lanza las agregaciones en un hilo de fondo. Sólo hay una agregación vigente: pedir otra cancela
 * la anterior y su resultado se descarta. El último resultado válido se conserva aunque una
 * agregación posterior falle.
 */
public class AggregationController implements AutoCloseable {

    private static final Logger logger = LoggerFactory.getLogger(AggregationController.class);

    private final FrameStore store;
    private final Supplier<CalibrationSettings> settings;
    private final ExecutorService exec;
    private final AtomicLong runIds = new AtomicLong();

    private AggregationRun currentRun;
    private volatile AggregationResult lastResult;

    public AggregationController(FrameStore store, Supplier<CalibrationSettings> settings) {
        this(store, settings, null);
    }

    /**
     * @param previous resultado de otro controlador que se sigue mostrando hasta que haya uno nuevo
     */
    public AggregationController(FrameStore store, Supplier<CalibrationSettings> settings,
                                 AggregationResult previous) {
        this.store = Objects.requireNonNull(store, "store");
        this.settings = Objects.requireNonNull(settings, "settings");
        this.lastResult = previous;
        this.exec = Executors.newSingleThreadExecutor(r -> {
            Thread t = new Thread(r, "session-aggregation");
            t.setDaemon(true);
            return t;
        });
    }

    public AggregationRun refresh(AggregationListener listener) {
        return refresh(DateRange.ALL, listener);
    }

    public synchronized AggregationRun refresh(DateRange range, AggregationListener listener) {
        Objects.requireNonNull(listener, "listener");
        if (currentRun != null && !currentRun.isDone()) {
            logger.debug("Cancelando agregación {} (sustituida)", currentRun.getId());
            currentRun.cancel();
        }
        AggregationRun run = new AggregationRun(runIds.incrementAndGet());
        currentRun = run;
        // La configuración se congela al pedir la agregación
        SessionAggregationService service = new SessionAggregationService(store, settings.get());
        exec.submit(() -> execute(service, range, run, listener));
        return run;
    }

    private void execute(SessionAggregationService service, DateRange range, AggregationRun run,
                         AggregationListener listener) {
        AggregationResult result;
        try {
            run.checkCancelled();
            result = service.aggregate(range, run, listener);
            synchronized (this) {
                if (run.isCancelled() || run != currentRun) throw new CancellationException();
                lastResult = result;
            }
            run.finish(AggregationRun.Outcome.COMPLETED);
        } catch (CancellationException e) {
            logger.debug("Agregación {} descartada", run.getId());
            run.finish(AggregationRun.Outcome.CANCELLED);
            return;
        } catch (FrameStoreException e) {
            fail(run, listener, e);
            return;
        } catch (RuntimeException e) {
            fail(run, listener, new FrameStoreException("Error inesperado: " + e.getMessage(), e));
            return;
        }

        // Fuera del try: un fallo del oyente no cambia el resultado de la agregación
        try {
            listener.onCompleted(result);
        } catch (RuntimeException e) {
            logger.error("El oyente de la agregación {} falló al recibir el resultado", run.getId(), e);
        }
    }

    private void fail(AggregationRun run, AggregationListener listener, FrameStoreException error) {
        if (run.isCancelled()) {
            logger.debug("Agregación {} cancelada antes del error: {}", run.getId(), error.getMessage());
            run.finish(AggregationRun.Outcome.CANCELLED);
            return;
        }
        logger.error("Agregación {} abortada: {}", run.getId(), error.getMessage(), error);
        run.finish(AggregationRun.Outcome.FAILED);
        try {
            listener.onFailed(run.getId(), error);
        } catch (RuntimeException e) {
            logger.error("El oyente de la agregación {} falló al recibir el error", run.getId(), e);
        }
    }

    /** Cancela la agregación en curso, si la hay. */
    public synchronized void cancel() {
        if (currentRun != null) currentRun.cancel();
    }

    public synchronized AggregationRun getCurrentRun() {
        return currentRun;
    }

    /** Último resultado completo publicado, o null si todavía no hay ninguno. */
    public AggregationResult getLastResult() {
        return lastResult;
    }

    @Override
    public void close() {
        cancel();
        exec.shutdownNow();
        try {
            if (!exec.awaitTermination(5, TimeUnit.SECONDS)) {
                logger.warn("El hilo de agregación no terminó a tiempo");
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
    }
}
