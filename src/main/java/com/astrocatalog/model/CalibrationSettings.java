package com.astrocatalog.model;

/**
 * Tolerancias y umbrales de emparejamiento. Inmutable: cada agregación trabaja con una copia fija.
 */
public final class CalibrationSettings {

    public static final double DEFAULT_TEMP_TOLERANCE_DARKS = 1.0;
    public static final double DEFAULT_TEMP_TOLERANCE_BIAS = 1.0;
    public static final double DEFAULT_TEMP_TOLERANCE_FLATS = 3.0;
    public static final double DEFAULT_EXPOSURE_TOLERANCE = 0.1;
    public static final int DEFAULT_RECOMMENDED_FRAMES = 20;
    public static final int DEFAULT_ACCEPTABLE_FRAMES = 10;

    public final double tempToleranceDarks;
    public final double tempToleranceBias;
    public final double tempToleranceFlats;
    public final double exposureTolerance;
    public final int recommendedFrames;
    public final int acceptableFrames;
    public final boolean includeMasters;
    // false = escaneo directo (camino frío), útil en catálogos pequeños o para validar la caché
    public final boolean useCache;

    public CalibrationSettings(double tempToleranceDarks, double tempToleranceBias, double tempToleranceFlats,
                               double exposureTolerance, int recommendedFrames, int acceptableFrames,
                               boolean includeMasters, boolean useCache) {
        if (tempToleranceDarks < 0 || tempToleranceBias < 0 || tempToleranceFlats < 0 || exposureTolerance < 0) {
            throw new IllegalArgumentException("Las tolerancias no pueden ser negativas");
        }
        if (recommendedFrames < 1 || acceptableFrames < 0 || acceptableFrames > recommendedFrames) {
            throw new IllegalArgumentException(
                    "Umbrales inválidos: aceptable=" + acceptableFrames + ", recomendado=" + recommendedFrames);
        }
        this.tempToleranceDarks = tempToleranceDarks;
        this.tempToleranceBias = tempToleranceBias;
        this.tempToleranceFlats = tempToleranceFlats;
        this.exposureTolerance = exposureTolerance;
        this.recommendedFrames = recommendedFrames;
        this.acceptableFrames = acceptableFrames;
        this.includeMasters = includeMasters;
        this.useCache = useCache;
    }

    public static CalibrationSettings defaults() {
        return new CalibrationSettings(DEFAULT_TEMP_TOLERANCE_DARKS, DEFAULT_TEMP_TOLERANCE_BIAS,
                DEFAULT_TEMP_TOLERANCE_FLATS, DEFAULT_EXPOSURE_TOLERANCE,
                DEFAULT_RECOMMENDED_FRAMES, DEFAULT_ACCEPTABLE_FRAMES, true, true);
    }

    public double temperatureTolerance(CalibrationType type) {
        switch (type) {
            case DARK: return tempToleranceDarks;
            case BIAS: return tempToleranceBias;
            default: return tempToleranceFlats;
        }
    }

    public CalibrationSettings withCache(boolean cache) {
        return new CalibrationSettings(tempToleranceDarks, tempToleranceBias, tempToleranceFlats, exposureTolerance,
                recommendedFrames, acceptableFrames, includeMasters, cache);
    }

    public CalibrationSettings withIncludeMasters(boolean masters) {
        return new CalibrationSettings(tempToleranceDarks, tempToleranceBias, tempToleranceFlats, exposureTolerance,
                recommendedFrames, acceptableFrames, masters, useCache);
    }
}
