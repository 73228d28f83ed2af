package com.astrocatalog.service;

import com.astrocatalog.model.AggregationDiagnostics;
import com.astrocatalog.model.AggregationResult;
import com.astrocatalog.model.CalibrationMatchResult;
import com.astrocatalog.model.CalibrationSettings;
import com.astrocatalog.model.CalibrationType;
import com.astrocatalog.model.DateRange;
import com.astrocatalog.model.Frame;
import com.astrocatalog.model.Session;
import com.astrocatalog.model.SessionAssessment;
import com.astrocatalog.model.SessionStatus;
import com.astrocatalog.store.FrameStore;
import com.astrocatalog.store.FrameStoreException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Una pasada completa y síncrona: lectura del catálogo (2 consultas), detección de sesiones,
 * caché de calibración, emparejamiento, estado y recomendaciones. La cancelación se comprueba
 * entre sesiones.
 */
public class SessionAggregationService {

    private static final Logger logger = LoggerFactory.getLogger(SessionAggregationService.class);

    private final FrameStore store;
    private final CalibrationSettings settings;
    private final SessionDetector detector = new SessionDetector();
    private final CalibrationCacheBuilder cacheBuilder = new CalibrationCacheBuilder();
    private final CalibrationMatcher matcher;
    private final SessionStatusClassifier classifier = new SessionStatusClassifier();
    private final RecommendationGenerator recommendations;

    public SessionAggregationService(FrameStore store, CalibrationSettings settings) {
        this.store = Objects.requireNonNull(store, "store");
        this.settings = Objects.requireNonNull(settings, "settings");
        this.matcher = new CalibrationMatcher(settings);
        this.recommendations = new RecommendationGenerator(settings);
    }

    public CalibrationSettings getSettings() {
        return settings;
    }

    public AggregationResult aggregate(DateRange range, AggregationRun run, AggregationListener listener)
            throws FrameStoreException {
        long id = run.getId();
        progress(listener, run, 0, 0, "Loading sessions...");
        List<Frame> lights = store.findLightFrames(range);
        run.checkCancelled();

        progress(listener, run, 0, 0, "Loading calibration data...");
        List<Frame> calibration = store.findCalibrationFrames(range);
        run.checkCancelled();

        SessionDetector.Detection detection = detector.detect(lights);
        run.checkCancelled();

        // En modo frío no hace falta índice, pero los inservibles se cuentan igual
        CalibrationCache cache = cacheBuilder.build(calibration);
        run.checkCancelled();

        List<Session> sessions = detection.sessions;
        int total = sessions.size();
        List<SessionAssessment> assessed = new ArrayList<>(total);
        progress(listener, run, 0, total, "Matching calibration frames...");

        for (int i = 0; i < total; i++) {
            run.checkCancelled();
            Session s = sessions.get(i);
            assessed.add(assess(s, cache, calibration));
            progress(listener, run, i + 1, total, s.displayName());
        }

        AggregationDiagnostics diagnostics = new AggregationDiagnostics(lights.size(), calibration.size(),
                detection.unassignableFrames, detection.mixedBinningSessions, cache.unusableCounts());
        if (diagnostics.hasIssues()) {
            logger.warn("Agregación {}: condiciones de calidad de datos ({})", id, diagnostics);
        }
        AggregationResult result = new AggregationResult(id, assessed, diagnostics);
        logger.info("Agregación {} terminada: {} sesiones ({} completas, {} parciales, {} sin calibración)",
                id, total, result.completeCount(), result.partialCount(), result.missingCount());
        return result;
    }

    SessionAssessment assess(Session s, CalibrationCache cache, List<Frame> calibration) {
        CalibrationMatchResult darks = match(s, CalibrationType.DARK, cache, calibration);
        CalibrationMatchResult bias = match(s, CalibrationType.BIAS, cache, calibration);
        CalibrationMatchResult flats = match(s, CalibrationType.FLAT, cache, calibration);
        SessionStatus status = classifier.classify(darks, bias, flats);
        if (logger.isDebugEnabled()) {
            logger.debug("{} -> {} {} {} {}", s, status, darks, bias, flats);
        }
        return new SessionAssessment(s, darks, bias, flats, status,
                recommendations.generate(s, status, darks, bias, flats));
    }

    private CalibrationMatchResult match(Session s, CalibrationType type, CalibrationCache cache,
                                         List<Frame> calibration) {
        return settings.useCache ? matcher.match(s, type, cache) : matcher.scan(s, type, calibration);
    }

    private static void progress(AggregationListener listener, AggregationRun run, int done, int total, String msg) {
        if (listener != null && !run.isCancelled()) listener.onProgress(run.getId(), done, total, msg);
    }
}
