package com.astrocatalog.model;

import java.time.LocalDate;

/** Rango de fechas inclusivo; cualquiera de los extremos puede ser null (abierto). */
public record DateRange(LocalDate from, LocalDate to) {

    public static final DateRange ALL = new DateRange(null, null);

    public DateRange {
        if (from != null && to != null && to.isBefore(from)) {
            throw new IllegalArgumentException("Rango invertido: " + from + " > " + to);
        }
    }

    public boolean contains(LocalDate date) {
        if (date == null) return from == null && to == null;
        if (from != null && date.isBefore(from)) return false;
        return to == null || !date.isAfter(to);
    }

    public boolean isUnbounded() {
        return from == null && to == null;
    }
}
