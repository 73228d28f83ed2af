package com.astrocatalog.service;

import com.astrocatalog.model.CalibrationType;
import com.astrocatalog.model.Frame;
import com.astrocatalog.service.CalibrationCache.BiasKey;
import com.astrocatalog.service.CalibrationCache.DarkKey;
import com.astrocatalog.service.CalibrationCache.FlatKey;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collection;
import java.util.EnumMap;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Recorre una sola vez los frames de calibración y construye los tres índices (darks, bias, flats).
 * Los frames sin los atributos que su tipo necesita no entran en la caché y se cuentan como inservibles.
 */
public class CalibrationCacheBuilder {

    private static final Logger logger = LoggerFactory.getLogger(CalibrationCacheBuilder.class);

    public CalibrationCache build(Collection<Frame> calibrationFrames) {
        Map<DarkKey, List<Frame>> darks = new HashMap<>();
        Map<BiasKey, List<Frame>> bias = new HashMap<>();
        Map<FlatKey, List<Frame>> flats = new HashMap<>();
        Map<CalibrationType, Integer> unusable = new EnumMap<>(CalibrationType.class);

        for (Frame f : calibrationFrames) {
            CalibrationType type = CalibrationType.of(f.kind);
            if (type == null) continue; // lights

            if (!isUsable(f, type)) {
                unusable.merge(type, 1, Integer::sum);
                continue;
            }

            long temp = CalibrationCache.temperatureBucket(f.sensorTemperatureC);
            switch (type) {
                case DARK:
                    darks.computeIfAbsent(new DarkKey(CalibrationCache.exposureBucket(f.exposureSeconds), temp,
                            f.binningX, f.binningY, f.instrument), k -> new ArrayList<>()).add(f);
                    break;
                case BIAS:
                    bias.computeIfAbsent(new BiasKey(temp, f.binningX, f.binningY, f.instrument),
                            k -> new ArrayList<>()).add(f);
                    break;
                case FLAT:
                    flats.computeIfAbsent(new FlatKey(f.filterName, f.sessionDate, temp, f.binningX, f.binningY,
                            f.instrument), k -> new ArrayList<>()).add(f);
                    break;
            }
        }

        CalibrationCache cache = new CalibrationCache(darks, bias, flats, unusable);
        logger.debug("Caché de calibración: {} cubos dark, {} bias, {} flat; inservibles {}",
                darks.size(), bias.size(), flats.size(), unusable);
        return cache;
    }

    /**
     * Atributos mínimos para poder emparejar: dark necesita exposición y temperatura,
     * bias temperatura, flat fecha y temperatura.
     */
    public static boolean isUsable(Frame f, CalibrationType type) {
        if (f.sensorTemperatureC == null) return false;
        switch (type) {
            case DARK: return f.exposureSeconds != null;
            case FLAT: return f.sessionDate != null;
            default: return true;
        }
    }
}
