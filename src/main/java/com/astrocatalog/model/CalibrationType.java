package com.astrocatalog.model;

public enum CalibrationType {
    DARK(CaptureKind.DARK, "dark", "Darks"),
    BIAS(CaptureKind.BIAS, "bias", "Bias"),
    FLAT(CaptureKind.FLAT, "flat", "Flats");

    private final CaptureKind captureKind;
    private final String noun;
    private final String label;

    CalibrationType(CaptureKind captureKind, String noun, String label) {
        this.captureKind = captureKind;
        this.noun = noun;
        this.label = label;
    }

    public CaptureKind captureKind() { return captureKind; }

    /** Nombre en minúsculas para los textos de recomendación ("dark", "bias", "flat"). */
    public String noun() { return noun; }

    /** Etiqueta de columna / informe. */
    public String label() { return label; }

    public static CalibrationType of(CaptureKind kind) {
        for (CalibrationType t : values()) {
            if (t.captureKind == kind) return t;
        }
        return null;
    }
}
