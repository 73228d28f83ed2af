package com.astrocatalog.model;

import java.util.Collections;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Una sesión con sus tres emparejamientos (dark, bias, flat), el estado global y las recomendaciones.
 */
public final class SessionAssessment {

    public final Session session;
    public final SessionStatus status;
    public final List<String> recommendations;
    private final Map<CalibrationType, CalibrationMatchResult> matches;

    public SessionAssessment(Session session, CalibrationMatchResult darks, CalibrationMatchResult bias,
                             CalibrationMatchResult flats, SessionStatus status, List<String> recommendations) {
        this.session = Objects.requireNonNull(session, "session");
        this.status = Objects.requireNonNull(status, "status");
        Map<CalibrationType, CalibrationMatchResult> m = new EnumMap<>(CalibrationType.class);
        m.put(CalibrationType.DARK, Objects.requireNonNull(darks, "darks"));
        m.put(CalibrationType.BIAS, Objects.requireNonNull(bias, "bias"));
        m.put(CalibrationType.FLAT, Objects.requireNonNull(flats, "flats"));
        this.matches = Collections.unmodifiableMap(m);
        this.recommendations = List.copyOf(recommendations);
    }

    public CalibrationMatchResult match(CalibrationType type) {
        return matches.get(type);
    }

    public CalibrationMatchResult darks() { return matches.get(CalibrationType.DARK); }
    public CalibrationMatchResult bias() { return matches.get(CalibrationType.BIAS); }
    public CalibrationMatchResult flats() { return matches.get(CalibrationType.FLAT); }

    public Map<CalibrationType, CalibrationMatchResult> matches() {
        return matches;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof SessionAssessment)) return false;
        SessionAssessment a = (SessionAssessment) o;
        return session.equals(a.session)
                && status == a.status && matches.equals(a.matches) && recommendations.equals(a.recommendations);
    }

    @Override
    public int hashCode() {
        return Objects.hash(session, status, matches, recommendations);
    }

    @Override
    public String toString() {
        return session + " " + status + " " + matches.values();
    }
}
