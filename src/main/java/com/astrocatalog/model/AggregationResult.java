package com.astrocatalog.model;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Conjunto completo de sesiones evaluadas en una agregación. Se entrega entero, nunca parcial.
 */
public final class AggregationResult {

    public final long runId;
    public final List<SessionAssessment> sessions;
    public final AggregationDiagnostics diagnostics;

    public AggregationResult(long runId, List<SessionAssessment> sessions, AggregationDiagnostics diagnostics) {
        this.runId = runId;
        this.sessions = List.copyOf(sessions);
        this.diagnostics = Objects.requireNonNull(diagnostics, "diagnostics");
    }

    public int count(SessionStatus status) {
        int n = 0;
        for (SessionAssessment s : sessions) if (s.status == status) n++;
        return n;
    }

    public int completeCount() {
        return count(SessionStatus.COMPLETE) + count(SessionStatus.COMPLETE_WITH_MASTERS);
    }

    public int partialCount() { return count(SessionStatus.PARTIAL); }

    public int missingCount() { return count(SessionStatus.MISSING); }

    /** Porcentaje de sesiones completas (0 si no hay sesiones). */
    public double completionRate() {
        if (sessions.isEmpty()) return 0;
        return completeCount() * 100.0 / sessions.size();
    }

    /**
     * Filtro de la vista de sesiones. {@code null} devuelve todas; COMPLETE incluye las que tienen masters.
     */
    public List<SessionAssessment> filterByStatus(SessionStatus status) {
        if (status == null) return sessions;
        List<SessionAssessment> out = new ArrayList<>();
        for (SessionAssessment s : sessions) {
            if (s.status == status || (status == SessionStatus.COMPLETE && s.status.isComplete())) out.add(s);
        }
        return out;
    }
}
