package com.astrocatalog.model;

import java.time.LocalDate;
import java.util.Objects;

/**
 * Una exposición importada en el catálogo. Los campos opcionales son null cuando la cabecera
 * no los trae; sólo id, kind y binning son obligatorios.
 */
public final class Frame {

    public final String id;
    public final CaptureKind kind;
    public final boolean master;
    public final String objectName;
    public final String filterName;
    public final Double exposureSeconds;
    public final Double sensorTemperatureC;
    public final int binningX;
    public final int binningY;
    public final LocalDate sessionDate;
    public final String instrument;

    private Frame(Builder b) {
        this.id = Objects.requireNonNull(b.id, "id");
        this.kind = Objects.requireNonNull(b.kind, "kind");
        if (b.binningX < 1 || b.binningY < 1) {
            throw new IllegalArgumentException("Binning inválido para " + b.id + ": " + b.binningX + "x" + b.binningY);
        }
        this.master = b.master;
        this.objectName = b.objectName;
        this.filterName = b.filterName;
        this.exposureSeconds = b.exposureSeconds;
        this.sensorTemperatureC = b.sensorTemperatureC;
        this.binningX = b.binningX;
        this.binningY = b.binningY;
        this.sessionDate = b.sessionDate;
        this.instrument = b.instrument;
    }

    public static Builder builder(String id, CaptureKind kind) {
        return new Builder(id, kind);
    }

    public static Builder light(String id) { return new Builder(id, CaptureKind.LIGHT); }
    public static Builder dark(String id) { return new Builder(id, CaptureKind.DARK); }
    public static Builder flat(String id) { return new Builder(id, CaptureKind.FLAT); }
    public static Builder bias(String id) { return new Builder(id, CaptureKind.BIAS); }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof Frame)) return false;
        return id.equals(((Frame) o).id);
    }

    @Override
    public int hashCode() {
        return id.hashCode();
    }

    @Override
    public String toString() {
        return String.format("Frame[%s %s%s exp=%s temp=%s %dx%d %s %s]",
                id, master ? "MASTER " : "", kind, exposureSeconds, sensorTemperatureC,
                binningX, binningY, sessionDate, instrument);
    }

    public static final class Builder {
        private final String id;
        private final CaptureKind kind;
        private boolean master;
        private String objectName;
        private String filterName;
        private Double exposureSeconds;
        private Double sensorTemperatureC;
        private int binningX = 1;
        private int binningY = 1;
        private LocalDate sessionDate;
        private String instrument;

        private Builder(String id, CaptureKind kind) {
            this.id = id;
            this.kind = kind;
        }

        public Builder master(boolean v) { this.master = v; return this; }
        public Builder object(String v) { this.objectName = v; return this; }
        public Builder filter(String v) { this.filterName = v; return this; }
        public Builder exposure(Double v) { this.exposureSeconds = v; return this; }
        public Builder temperature(Double v) { this.sensorTemperatureC = v; return this; }
        public Builder binning(int x, int y) { this.binningX = x; this.binningY = y; return this; }
        public Builder date(LocalDate v) { this.sessionDate = v; return this; }
        public Builder instrument(String v) { this.instrument = v; return this; }

        public Frame build() {
            return new Frame(this);
        }
    }
}
