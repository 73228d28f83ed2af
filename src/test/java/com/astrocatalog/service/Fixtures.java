package com.astrocatalog.service;

import com.astrocatalog.model.Frame;

import java.time.LocalDate;
import java.util.ArrayList;
import java.util.List;

/**
 * Frames de prueba.
 */
final class Fixtures {

    static final LocalDate NIGHT = LocalDate.of(2024, 1, 15);

    private Fixtures() {}

    static List<Frame> lights(String prefix, int n, String object, String filter, String instrument,
                              double exposure, double temp) {
        List<Frame> out = new ArrayList<>();
        for (int i = 0; i < n; i++) {
            out.add(Frame.light(prefix + i).object(object).filter(filter).instrument(instrument)
                    .exposure(exposure).temperature(temp).date(NIGHT).build());
        }
        return out;
    }

    static List<Frame> darks(String prefix, int n, double exposure, double temp, String instrument) {
        List<Frame> out = new ArrayList<>();
        for (int i = 0; i < n; i++) {
            out.add(Frame.dark(prefix + i).exposure(exposure).temperature(temp).instrument(instrument).build());
        }
        return out;
    }

    static List<Frame> bias(String prefix, int n, double temp, String instrument) {
        List<Frame> out = new ArrayList<>();
        for (int i = 0; i < n; i++) {
            out.add(Frame.bias(prefix + i).temperature(temp).instrument(instrument).build());
        }
        return out;
    }

    static List<Frame> flats(String prefix, int n, String filter, LocalDate date, double temp, String instrument) {
        List<Frame> out = new ArrayList<>();
        for (int i = 0; i < n; i++) {
            out.add(Frame.flat(prefix + i).filter(filter).date(date).temperature(temp).instrument(instrument)
                    .exposure(2.0).build());
        }
        return out;
    }
}
