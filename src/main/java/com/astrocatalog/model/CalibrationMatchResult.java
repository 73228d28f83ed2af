package com.astrocatalog.model;

import java.util.Objects;

/**
 * Resultado de emparejar un tipo de calibración contra una sesión.
 * El score es función de frameCount únicamente; no se almacena aparte.
 */
public final class CalibrationMatchResult {

    public final CalibrationType type;
    public final int frameCount;
    public final int masterCount;
    // Temperatura media de los frames emparejados (null si no hay)
    public final Double avgTemperatureC;

    private final int recommendedFrames;
    private final int acceptableFrames;

    public CalibrationMatchResult(CalibrationType type, int frameCount, int masterCount, Double avgTemperatureC,
                                  CalibrationSettings settings) {
        if (frameCount < 0 || masterCount < 0) {
            throw new IllegalArgumentException("Conteos negativos: " + frameCount + "/" + masterCount);
        }
        this.type = type;
        this.frameCount = frameCount;
        this.masterCount = masterCount;
        this.avgTemperatureC = avgTemperatureC;
        this.recommendedFrames = settings.recommendedFrames;
        this.acceptableFrames = settings.acceptableFrames;
    }

    public boolean hasMaster() {
        return masterCount > 0;
    }

    public int qualityScore() {
        return QualityScore.of(frameCount, recommendedFrames);
    }

    /** frameCount >= mínimo aceptable, o hay un master que lo respalda. */
    public boolean isSatisfied() {
        return frameCount >= acceptableFrames || hasMaster();
    }

    public boolean isEmpty() {
        return frameCount == 0 && !hasMaster();
    }

    public int missingToRecommended() {
        return Math.max(0, recommendedFrames - frameCount);
    }

    public String displayText() {
        if (hasMaster()) return "✓ " + frameCount + " + " + masterCount + " Master";
        if (frameCount >= acceptableFrames) return "✓ " + frameCount + " frames";
        if (frameCount > 0) return "⚠ " + frameCount + " frames (need " + acceptableFrames + "+)";
        return "✗ Missing";
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof CalibrationMatchResult)) return false;
        CalibrationMatchResult r = (CalibrationMatchResult) o;
        return type == r.type && frameCount == r.frameCount && masterCount == r.masterCount
                && Objects.equals(avgTemperatureC, r.avgTemperatureC)
                && recommendedFrames == r.recommendedFrames && acceptableFrames == r.acceptableFrames;
    }

    @Override
    public int hashCode() {
        return Objects.hash(type, frameCount, masterCount, avgTemperatureC);
    }

    @Override
    public String toString() {
        return type + "[" + displayText() + ", score=" + qualityScore() + "]";
    }
}
