package com.astrocatalog.service;

import com.astrocatalog.model.CalibrationMatchResult;
import com.astrocatalog.model.SessionStatus;

/**
 * Estado global de una sesión a partir de sus tres emparejamientos. Sin historial:
 * se recalcula en cada agregación.
 */
public class SessionStatusClassifier {

    public SessionStatus classify(CalibrationMatchResult darks, CalibrationMatchResult bias,
                                  CalibrationMatchResult flats) {
        if (darks.isEmpty() && bias.isEmpty() && flats.isEmpty()) {
            return SessionStatus.MISSING;
        }
        if (darks.isSatisfied() && bias.isSatisfied() && flats.isSatisfied()) {
            boolean anyMaster = darks.hasMaster() || bias.hasMaster() || flats.hasMaster();
            return anyMaster ? SessionStatus.COMPLETE_WITH_MASTERS : SessionStatus.COMPLETE;
        }
        return SessionStatus.PARTIAL;
    }
}
