package com.astrocatalog.model;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.prefs.Preferences;

public class AppConfig {
    private static final Logger logger = LoggerFactory.getLogger(AppConfig.class);
    private static final Preferences prefs = Preferences.userNodeForPackage(AppConfig.class);

    // Tolerancias de emparejamiento
    private static final String KEY_TEMP_TOL_DARKS = "temp_tolerance_darks";
    private static final String KEY_TEMP_TOL_BIAS = "temp_tolerance_bias";
    private static final String KEY_TEMP_TOL_FLATS = "temp_tolerance_flats";
    private static final String KEY_EXPOSURE_TOL = "exposure_tolerance";

    // Umbrales de calidad
    private static final String KEY_MIN_RECOMMENDED = "min_frames_recommended";
    private static final String KEY_MIN_ACCEPTABLE = "min_frames_acceptable";
    private static final String KEY_INCLUDE_MASTERS = "include_masters";
    private static final String KEY_USE_CACHE = "use_calibration_cache";

    // Catálogo
    private static final String KEY_CATALOG_DIR = "catalog_directory";
    private static final String KEY_RECURSIVE = "catalog_recursive";

    // --- TOLERANCIAS ---
    public static double getTempToleranceDarks() { return prefs.getDouble(KEY_TEMP_TOL_DARKS, CalibrationSettings.DEFAULT_TEMP_TOLERANCE_DARKS); }
    public static void setTempToleranceDarks(double v) { prefs.putDouble(KEY_TEMP_TOL_DARKS, v); }

    public static double getTempToleranceBias() { return prefs.getDouble(KEY_TEMP_TOL_BIAS, CalibrationSettings.DEFAULT_TEMP_TOLERANCE_BIAS); }
    public static void setTempToleranceBias(double v) { prefs.putDouble(KEY_TEMP_TOL_BIAS, v); }

    public static double getTempToleranceFlats() { return prefs.getDouble(KEY_TEMP_TOL_FLATS, CalibrationSettings.DEFAULT_TEMP_TOLERANCE_FLATS); }
    public static void setTempToleranceFlats(double v) { prefs.putDouble(KEY_TEMP_TOL_FLATS, v); }

    public static double getExposureTolerance() { return prefs.getDouble(KEY_EXPOSURE_TOL, CalibrationSettings.DEFAULT_EXPOSURE_TOLERANCE); }
    public static void setExposureTolerance(double v) { prefs.putDouble(KEY_EXPOSURE_TOL, v); }

    // --- UMBRALES ---
    public static int getMinFramesRecommended() { return prefs.getInt(KEY_MIN_RECOMMENDED, CalibrationSettings.DEFAULT_RECOMMENDED_FRAMES); }
    public static void setMinFramesRecommended(int v) { prefs.putInt(KEY_MIN_RECOMMENDED, v); }

    public static int getMinFramesAcceptable() { return prefs.getInt(KEY_MIN_ACCEPTABLE, CalibrationSettings.DEFAULT_ACCEPTABLE_FRAMES); }
    public static void setMinFramesAcceptable(int v) { prefs.putInt(KEY_MIN_ACCEPTABLE, v); }

    public static boolean isIncludeMasters() { return prefs.getBoolean(KEY_INCLUDE_MASTERS, true); }
    public static void setIncludeMasters(boolean v) { prefs.putBoolean(KEY_INCLUDE_MASTERS, v); }

    public static boolean isUseCache() { return prefs.getBoolean(KEY_USE_CACHE, true); }
    public static void setUseCache(boolean v) { prefs.putBoolean(KEY_USE_CACHE, v); }

    // --- CATÁLOGO ---
    public static String getCatalogDirectory() {
        return prefs.get(KEY_CATALOG_DIR, ""); // Sin default, usuario debe elegir
    }
    public static void setCatalogDirectory(String v) { prefs.put(KEY_CATALOG_DIR, v); }

    public static boolean isCatalogRecursive() { return prefs.getBoolean(KEY_RECURSIVE, true); }
    public static void setCatalogRecursive(boolean v) { prefs.putBoolean(KEY_RECURSIVE, v); }

    /**
     * Foto inmutable de la configuración actual para una agregación.
     * Si los valores guardados son incoherentes se vuelve a los valores por defecto.
     */
    public static CalibrationSettings toCalibrationSettings() {
        try {
            return new CalibrationSettings(getTempToleranceDarks(), getTempToleranceBias(), getTempToleranceFlats(),
                    getExposureTolerance(), getMinFramesRecommended(), getMinFramesAcceptable(),
                    isIncludeMasters(), isUseCache());
        } catch (IllegalArgumentException e) {
            logger.warn("Configuración de calibración inválida ({}), usando valores por defecto", e.getMessage());
            return CalibrationSettings.defaults();
        }
    }
}
