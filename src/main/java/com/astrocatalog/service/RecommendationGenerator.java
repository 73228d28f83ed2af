package com.astrocatalog.service;

import com.astrocatalog.model.CalibrationMatchResult;
import com.astrocatalog.model.CalibrationSettings;
import com.astrocatalog.model.CalibrationType;
import com.astrocatalog.model.Session;
import com.astrocatalog.model.SessionStatus;

import java.util.ArrayList;
import java.util.EnumMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * Texto de recomendaciones para una sesión ya emparejada. No hace ningún emparejamiento nuevo.
 */
public class RecommendationGenerator {

    public static final String ALL_PRESENT = "✓ All calibration frames are present";
    public static final String MASTERS_PRESENT = "✓ Session has master calibration frames available";

    private final CalibrationSettings settings;

    public RecommendationGenerator(CalibrationSettings settings) {
        this.settings = settings;
    }

    public List<String> generate(Session session, SessionStatus status, CalibrationMatchResult darks,
                                 CalibrationMatchResult bias, CalibrationMatchResult flats) {
        Map<CalibrationType, CalibrationMatchResult> byType = new EnumMap<>(CalibrationType.class);
        byType.put(CalibrationType.DARK, darks);
        byType.put(CalibrationType.BIAS, bias);
        byType.put(CalibrationType.FLAT, flats);

        List<String> out = new ArrayList<>();
        if (status.isComplete()) {
            out.add(status == SessionStatus.COMPLETE_WITH_MASTERS ? MASTERS_PRESENT : ALL_PRESENT);
            for (CalibrationMatchResult r : byType.values()) {
                if (!r.hasMaster() && r.frameCount < settings.recommendedFrames) {
                    out.add(String.format(Locale.US, "Consider adding %d more %s frames (currently %d, recommended %d+)",
                            r.missingToRecommended(), r.type.noun(), r.frameCount, settings.recommendedFrames));
                }
            }
            return out;
        }

        for (CalibrationMatchResult r : byType.values()) {
            if (r.hasMaster() || r.frameCount >= settings.recommendedFrames) continue;
            out.add(captureInstruction(session, r));
        }
        return out;
    }

    private String captureInstruction(Session s, CalibrationMatchResult r) {
        StringBuilder sb = new StringBuilder();
        sb.append("Capture ").append(r.missingToRecommended()).append(" more ").append(r.type.noun()).append(" frames at ");
        switch (r.type) {
            case DARK:
                sb.append(approx(s.avgExposureSeconds, s.exposureLabel())).append(", ");
                break;
            case FLAT:
                sb.append(s.filterName != null ? s.filterName : "No Filter").append(" filter, night of ")
                        .append(s.sessionDate).append(", ");
                break;
            default:
                break;
        }
        sb.append(approx(s.avgTemperatureC, s.temperatureLabel())).append(", ").append(s.binningLabel()).append(" binning");
        sb.append(String.format(Locale.US, " (currently %d, minimum %d, recommended %d+)",
                r.frameCount, settings.acceptableFrames, settings.recommendedFrames));
        if (s.instrument != null) sb.append(" with ").append(s.instrument);
        return sb.toString();
    }

    private static String approx(Double value, String label) {
        return value != null ? "~" + label : label;
    }
}
