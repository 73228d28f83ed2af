package com.astrocatalog.service;

import com.astrocatalog.model.CalibrationType;
import com.astrocatalog.model.Frame;
import com.astrocatalog.model.Session;

import java.time.LocalDate;
import java.util.ArrayList;
import java.util.Collections;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Índice de frames de calibración de una agregación. Se construye una vez con
 * {@link CalibrationCacheBuilder} y después sólo se lee, así que puede consultarse desde varios hilos.
 * <p>
 * Exposición en décimas de segundo y temperatura en grados enteros. Como la tolerancia abarca
 * varios cubos, cada consulta recorre todos los cubos que pueden contener un frame compatible.
 */
public final class CalibrationCache {

    // Holgura para comparaciones en coma flotante (300.1 - 300.0 no es exactamente 0.1)
    static final double EPSILON = 1e-9;

    record DarkKey(long exposureTenths, long temperature, int binningX, int binningY, String instrument) {}

    record BiasKey(long temperature, int binningX, int binningY, String instrument) {}

    record FlatKey(String filter, LocalDate date, long temperature, int binningX, int binningY, String instrument) {}

    private final Map<DarkKey, List<Frame>> darks;
    private final Map<BiasKey, List<Frame>> bias;
    private final Map<FlatKey, List<Frame>> flats;
    private final Map<CalibrationType, Integer> unusable;

    CalibrationCache(Map<DarkKey, List<Frame>> darks, Map<BiasKey, List<Frame>> bias,
                     Map<FlatKey, List<Frame>> flats, Map<CalibrationType, Integer> unusable) {
        this.darks = freeze(darks);
        this.bias = freeze(bias);
        this.flats = freeze(flats);
        Map<CalibrationType, Integer> counts = new EnumMap<>(CalibrationType.class);
        counts.putAll(unusable);
        this.unusable = Collections.unmodifiableMap(counts);
    }

    private static <K> Map<K, List<Frame>> freeze(Map<K, List<Frame>> m) {
        for (Map.Entry<K, List<Frame>> e : m.entrySet()) {
            e.setValue(List.copyOf(e.getValue()));
        }
        return Collections.unmodifiableMap(m);
    }

    static long exposureBucket(double seconds) {
        return Math.round(seconds * 10.0);
    }

    static long temperatureBucket(double celsius) {
        return Math.round(celsius);
    }

    /**
     * Frames candidatos para la sesión: los de todos los cubos dentro de tolerancia.
     * El llamador debe aplicar después la comprobación exacta.
     */
    public List<Frame> candidates(CalibrationType type, Session session, double temperatureTolerance,
                                  double exposureTolerance) {
        switch (type) {
            case DARK: return darkCandidates(session, temperatureTolerance, exposureTolerance);
            case BIAS: return biasCandidates(session, temperatureTolerance);
            default: return flatCandidates(session, temperatureTolerance);
        }
    }

    private List<Frame> darkCandidates(Session s, double tempTol, double expTol) {
        if (s.avgExposureSeconds == null) return List.of();
        long expLo = exposureBucket(s.avgExposureSeconds - expTol - EPSILON);
        long expHi = exposureBucket(s.avgExposureSeconds + expTol + EPSILON);
        List<Frame> out = new ArrayList<>();

        if (s.avgTemperatureC == null) {
            // Sin temperatura de sesión no se filtra por temperatura: recorremos las claves
            for (Map.Entry<DarkKey, List<Frame>> e : darks.entrySet()) {
                DarkKey k = e.getKey();
                if (k.exposureTenths() >= expLo && k.exposureTenths() <= expHi
                        && k.binningX() == s.binningX && k.binningY() == s.binningY
                        && Objects.equals(k.instrument(), s.instrument)) {
                    out.addAll(e.getValue());
                }
            }
            return out;
        }

        long tLo = temperatureBucket(s.avgTemperatureC - tempTol - EPSILON);
        long tHi = temperatureBucket(s.avgTemperatureC + tempTol + EPSILON);
        for (long exp = expLo; exp <= expHi; exp++) {
            for (long t = tLo; t <= tHi; t++) {
                List<Frame> bucket = darks.get(new DarkKey(exp, t, s.binningX, s.binningY, s.instrument));
                if (bucket != null) out.addAll(bucket);
            }
        }
        return out;
    }

    private List<Frame> biasCandidates(Session s, double tempTol) {
        List<Frame> out = new ArrayList<>();
        if (s.avgTemperatureC == null) {
            for (Map.Entry<BiasKey, List<Frame>> e : bias.entrySet()) {
                BiasKey k = e.getKey();
                if (k.binningX() == s.binningX && k.binningY() == s.binningY
                        && Objects.equals(k.instrument(), s.instrument)) {
                    out.addAll(e.getValue());
                }
            }
            return out;
        }

        long tLo = temperatureBucket(s.avgTemperatureC - tempTol - EPSILON);
        long tHi = temperatureBucket(s.avgTemperatureC + tempTol + EPSILON);
        for (long t = tLo; t <= tHi; t++) {
            List<Frame> bucket = bias.get(new BiasKey(t, s.binningX, s.binningY, s.instrument));
            if (bucket != null) out.addAll(bucket);
        }
        return out;
    }

    private List<Frame> flatCandidates(Session s, double tempTol) {
        List<Frame> out = new ArrayList<>();
        if (s.avgTemperatureC == null) {
            for (Map.Entry<FlatKey, List<Frame>> e : flats.entrySet()) {
                FlatKey k = e.getKey();
                if (Objects.equals(k.filter(), s.filterName) && k.date().equals(s.sessionDate)
                        && k.binningX() == s.binningX && k.binningY() == s.binningY
                        && Objects.equals(k.instrument(), s.instrument)) {
                    out.addAll(e.getValue());
                }
            }
            return out;
        }

        long tLo = temperatureBucket(s.avgTemperatureC - tempTol - EPSILON);
        long tHi = temperatureBucket(s.avgTemperatureC + tempTol + EPSILON);
        for (long t = tLo; t <= tHi; t++) {
            List<Frame> bucket = flats.get(
                    new FlatKey(s.filterName, s.sessionDate, t, s.binningX, s.binningY, s.instrument));
            if (bucket != null) out.addAll(bucket);
        }
        return out;
    }

    public int unusable(CalibrationType type) {
        return unusable.getOrDefault(type, 0);
    }

    public Map<CalibrationType, Integer> unusableCounts() {
        return unusable;
    }

    public int bucketCount(CalibrationType type) {
        switch (type) {
            case DARK: return darks.size();
            case BIAS: return bias.size();
            default: return flats.size();
        }
    }

    public int frameCount(CalibrationType type) {
        Map<?, List<Frame>> m = type == CalibrationType.DARK ? darks : type == CalibrationType.BIAS ? bias : flats;
        int n = 0;
        for (List<Frame> l : m.values()) n += l.size();
        return n;
    }
}
