package com.astrocatalog.model;

import java.util.Collections;
import java.util.EnumMap;
import java.util.Map;

/**
 * Condiciones de calidad de datos detectadas en una agregación. Nunca son errores fatales.
 */
public final class AggregationDiagnostics {

    public final int lightFramesScanned;
    public final int calibrationFramesScanned;
    // Lights sin fecha de sesión: no se pueden agrupar
    public final int unassignableLightFrames;
    public final int mixedBinningSessions;
    private final Map<CalibrationType, Integer> unusableCalibration;

    public AggregationDiagnostics(int lightFramesScanned, int calibrationFramesScanned, int unassignableLightFrames,
                                  int mixedBinningSessions, Map<CalibrationType, Integer> unusableCalibration) {
        this.lightFramesScanned = lightFramesScanned;
        this.calibrationFramesScanned = calibrationFramesScanned;
        this.unassignableLightFrames = unassignableLightFrames;
        this.mixedBinningSessions = mixedBinningSessions;
        Map<CalibrationType, Integer> copy = new EnumMap<>(CalibrationType.class);
        for (CalibrationType t : CalibrationType.values()) {
            copy.put(t, unusableCalibration.getOrDefault(t, 0));
        }
        this.unusableCalibration = Collections.unmodifiableMap(copy);
    }

    public int unusableCalibration(CalibrationType type) {
        return unusableCalibration.get(type);
    }

    public int unusableCalibrationTotal() {
        int total = 0;
        for (int n : unusableCalibration.values()) total += n;
        return total;
    }

    public boolean hasIssues() {
        return unassignableLightFrames > 0 || mixedBinningSessions > 0 || unusableCalibrationTotal() > 0;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof AggregationDiagnostics)) return false;
        AggregationDiagnostics d = (AggregationDiagnostics) o;
        return lightFramesScanned == d.lightFramesScanned && calibrationFramesScanned == d.calibrationFramesScanned
                && unassignableLightFrames == d.unassignableLightFrames
                && mixedBinningSessions == d.mixedBinningSessions && unusableCalibration.equals(d.unusableCalibration);
    }

    @Override
    public int hashCode() {
        return unusableCalibration.hashCode() * 31 + unassignableLightFrames;
    }

    @Override
    public String toString() {
        return String.format("lights=%d, calibración=%d, sin fecha=%d, binning mixto=%d, inservibles=%s",
                lightFramesScanned, calibrationFramesScanned, unassignableLightFrames, mixedBinningSessions,
                unusableCalibration);
    }
}
