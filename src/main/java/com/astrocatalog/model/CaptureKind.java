package com.astrocatalog.model;

import java.util.Locale;

public enum CaptureKind {
    LIGHT, DARK, FLAT, BIAS;

    public boolean isCalibration() {
        return this != LIGHT;
    }

    /**
     * Interpreta el valor IMAGETYP de una cabecera ("Light Frame", "Master Dark", "Offset"...).
     * Devuelve null si no se reconoce.
     */
    public static CaptureKind fromImageType(String imageType) {
        if (imageType == null) return null;
        String t = imageType.trim().toLowerCase(Locale.ROOT);
        if (t.contains("light")) return LIGHT;
        if (t.contains("dark")) return DARK;
        if (t.contains("flat")) return FLAT;
        if (t.contains("bias") || t.contains("offset") || t.contains("zero")) return BIAS;
        return null;
    }

    public static boolean isMasterImageType(String imageType) {
        return imageType != null && imageType.toLowerCase(Locale.ROOT).contains("master");
    }
}
