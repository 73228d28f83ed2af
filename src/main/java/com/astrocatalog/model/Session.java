package com.astrocatalog.model;

import java.time.LocalDate;
import java.util.Locale;
import java.util.Objects;

/**
 * Sesión de captura derivada de los lights que comparten fecha, objeto, filtro e instrumento.
 * Se construye en cada agregación y no se modifica después.
 */
public final class Session {

    public final LocalDate sessionDate;
    public final String objectName;
    public final String filterName;
    public final String instrument;

    public final int lightFrameCount;
    public final Double avgExposureSeconds;
    public final Double avgTemperatureC;
    public final int binningX;
    public final int binningY;
    // true si el grupo contiene lights con distinto binning (se usa el del primero)
    public final boolean mixedBinning;

    public Session(LocalDate sessionDate, String objectName, String filterName, String instrument,
                   int lightFrameCount, Double avgExposureSeconds, Double avgTemperatureC,
                   int binningX, int binningY, boolean mixedBinning) {
        this.sessionDate = sessionDate;
        this.objectName = objectName;
        this.filterName = filterName;
        this.instrument = instrument;
        this.lightFrameCount = lightFrameCount;
        this.avgExposureSeconds = avgExposureSeconds;
        this.avgTemperatureC = avgTemperatureC;
        this.binningX = binningX;
        this.binningY = binningY;
        this.mixedBinning = mixedBinning;
    }

    public String displayName() {
        return String.format("%s - %s - %s", sessionDate,
                objectName != null ? objectName : "Unknown Object",
                filterName != null ? filterName : "No Filter");
    }

    public String binningLabel() {
        return binningX + "x" + binningY;
    }

    public String exposureLabel() {
        return avgExposureSeconds != null ? String.format(Locale.US, "%.1fs", avgExposureSeconds) : "unknown exposure";
    }

    public String temperatureLabel() {
        return avgTemperatureC != null ? Math.round(avgTemperatureC) + "°C" : "unknown temperature";
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof Session)) return false;
        Session s = (Session) o;
        return lightFrameCount == s.lightFrameCount && binningX == s.binningX && binningY == s.binningY
                && mixedBinning == s.mixedBinning
                && Objects.equals(sessionDate, s.sessionDate) && Objects.equals(objectName, s.objectName)
                && Objects.equals(filterName, s.filterName) && Objects.equals(instrument, s.instrument)
                && Objects.equals(avgExposureSeconds, s.avgExposureSeconds)
                && Objects.equals(avgTemperatureC, s.avgTemperatureC);
    }

    @Override
    public int hashCode() {
        return Objects.hash(sessionDate, objectName, filterName, instrument, lightFrameCount);
    }

    @Override
    public String toString() {
        return "Session[" + displayName() + " / " + (instrument != null ? instrument : "-")
                + ", lights=" + lightFrameCount + "]";
    }
}
