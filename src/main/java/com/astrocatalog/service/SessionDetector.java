package com.astrocatalog.service;

import com.astrocatalog.model.CaptureKind;
import com.astrocatalog.model.Frame;
import com.astrocatalog.model.Session;

import java.time.LocalDate;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Agrupa los lights en sesiones por (fecha, objeto, filtro, instrumento). Dos valores null
 * se consideran iguales; null y un valor concreto no.
 */
public class SessionDetector {

    // Orden de la vista: fecha descendente, luego objeto, filtro e instrumento (null primero)
    static final Comparator<Session> SESSION_ORDER = Comparator
            .comparing((Session s) -> s.sessionDate, Comparator.reverseOrder())
            .thenComparing((Session s) -> s.objectName, Comparator.nullsFirst(Comparator.naturalOrder()))
            .thenComparing((Session s) -> s.filterName, Comparator.nullsFirst(Comparator.naturalOrder()))
            .thenComparing((Session s) -> s.instrument, Comparator.nullsFirst(Comparator.naturalOrder()));

    public Detection detect(Collection<Frame> lightFrames) {
        Map<SessionKey, Accumulator> groups = new LinkedHashMap<>();
        int unassignable = 0;

        for (Frame f : lightFrames) {
            if (f.kind != CaptureKind.LIGHT) continue;
            if (f.sessionDate == null) {
                unassignable++;
                continue;
            }
            SessionKey key = new SessionKey(f.sessionDate, f.objectName, f.filterName, f.instrument);
            groups.computeIfAbsent(key, k -> new Accumulator(f)).add(f);
        }

        List<Session> sessions = new ArrayList<>(groups.size());
        int mixed = 0;
        for (Map.Entry<SessionKey, Accumulator> e : groups.entrySet()) {
            Session s = e.getValue().toSession(e.getKey());
            if (s.mixedBinning) mixed++;
            sessions.add(s);
        }
        sessions.sort(SESSION_ORDER);
        return new Detection(sessions, unassignable, mixed);
    }

    /** Clave de agrupación; la igualdad del record trata null == null. */
    record SessionKey(LocalDate date, String object, String filter, String instrument) {}

    private static final class Accumulator {
        final int binningX;
        final int binningY;
        int count;
        boolean mixedBinning;
        double exposureSum;
        int exposureCount;
        double temperatureSum;
        int temperatureCount;

        Accumulator(Frame first) {
            this.binningX = first.binningX;
            this.binningY = first.binningY;
        }

        void add(Frame f) {
            count++;
            if (f.binningX != binningX || f.binningY != binningY) mixedBinning = true;
            if (f.exposureSeconds != null) {
                exposureSum += f.exposureSeconds;
                exposureCount++;
            }
            if (f.sensorTemperatureC != null) {
                temperatureSum += f.sensorTemperatureC;
                temperatureCount++;
            }
        }

        Session toSession(SessionKey key) {
            Double avgExposure = exposureCount > 0 ? exposureSum / exposureCount : null;
            Double avgTemperature = temperatureCount > 0 ? temperatureSum / temperatureCount : null;
            return new Session(key.date(), key.object(), key.filter(), key.instrument(), count,
                    avgExposure, avgTemperature, binningX, binningY, mixedBinning);
        }
    }

    public static final class Detection {
        public final List<Session> sessions;
        public final int unassignableFrames;
        public final int mixedBinningSessions;

        Detection(List<Session> sessions, int unassignableFrames, int mixedBinningSessions) {
            this.sessions = List.copyOf(sessions);
            this.unassignableFrames = unassignableFrames;
            this.mixedBinningSessions = mixedBinningSessions;
        }
    }
}
