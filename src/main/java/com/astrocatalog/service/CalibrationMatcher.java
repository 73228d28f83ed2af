package com.astrocatalog.service;

import com.astrocatalog.model.CalibrationMatchResult;
import com.astrocatalog.model.CalibrationSettings;
import com.astrocatalog.model.CalibrationType;
import com.astrocatalog.model.Frame;
import com.astrocatalog.model.Session;

import java.util.Arrays;
import java.util.Collection;
import java.util.LinkedHashSet;
import java.util.Objects;
import java.util.Set;

/**
 * Empareja una sesión con los frames de calibración compatibles, por escaneo directo (camino frío)
 * o consultando la {@link CalibrationCache} (camino caliente). Los dos caminos usan la misma
 * comprobación, así que el resultado es idéntico.
 * <p>
 * El instrumento y el filtro se comparan con null == null: una sesión sin instrumento nunca
 * se empareja con calibración de una cámara concreta, ni al revés.
 */
public class CalibrationMatcher {

    private final CalibrationSettings settings;

    public CalibrationMatcher(CalibrationSettings settings) {
        this.settings = Objects.requireNonNull(settings, "settings");
    }

    public CalibrationSettings getSettings() {
        return settings;
    }

    /** Camino caliente. */
    public CalibrationMatchResult match(Session session, CalibrationType type, CalibrationCache cache) {
        return summarize(session, type, cache.candidates(type, session,
                settings.temperatureTolerance(type), settings.exposureTolerance));
    }

    /** Camino frío: recorre todos los frames recibidos. */
    public CalibrationMatchResult scan(Session session, CalibrationType type, Collection<Frame> frames) {
        return summarize(session, type, frames);
    }

    private CalibrationMatchResult summarize(Session session, CalibrationType type, Collection<Frame> candidates) {
        // Frames distintos por id, en orden de llegada
        Set<Frame> matched = new LinkedHashSet<>();
        for (Frame f : candidates) {
            if (isCompatible(session, type, f)) matched.add(f);
        }

        int frames = 0;
        int masters = 0;
        double[] temps = new double[matched.size()];
        int i = 0;
        for (Frame f : matched) {
            if (f.master) masters++;
            else frames++;
            temps[i++] = f.sensorTemperatureC;
        }
        // Suma en orden fijo: la media no depende del orden de los candidatos
        Arrays.sort(temps);
        double tempSum = 0;
        for (double t : temps) tempSum += t;
        Double avgTemp = matched.isEmpty() ? null : tempSum / matched.size();
        return new CalibrationMatchResult(type, frames, masters, avgTemp, settings);
    }

    /**
     * Comprobación exacta de compatibilidad, común a los dos caminos.
     */
    public boolean isCompatible(Session session, CalibrationType type, Frame f) {
        if (CalibrationType.of(f.kind) != type) return false;
        if (!CalibrationCacheBuilder.isUsable(f, type)) return false;
        if (f.master && !settings.includeMasters) return false;

        if (f.binningX != session.binningX || f.binningY != session.binningY) return false;
        if (!Objects.equals(f.instrument, session.instrument)) return false;
        if (!withinTemperature(session.avgTemperatureC, f.sensorTemperatureC, settings.temperatureTolerance(type))) {
            return false;
        }

        switch (type) {
            case DARK:
                return session.avgExposureSeconds != null
                        && within(f.exposureSeconds, session.avgExposureSeconds, settings.exposureTolerance);
            case FLAT:
                return Objects.equals(f.filterName, session.filterName) && f.sessionDate.equals(session.sessionDate);
            default:
                return true;
        }
    }

    private static boolean withinTemperature(Double sessionTemp, double frameTemp, double tolerance) {
        // Sesión sin temperatura registrada: no se aplica el criterio
        return sessionTemp == null || within(frameTemp, sessionTemp, tolerance);
    }

    static boolean within(double value, double reference, double tolerance) {
        return Math.abs(value - reference) <= tolerance + CalibrationCache.EPSILON;
    }
}
