package com.astrocatalog.service;

import com.astrocatalog.model.AggregationDiagnostics;
import com.astrocatalog.model.AggregationResult;
import com.astrocatalog.model.CalibrationMatchResult;
import com.astrocatalog.model.CalibrationType;
import com.astrocatalog.model.Session;
import com.astrocatalog.model.SessionAssessment;

import java.io.IOException;
import java.io.PrintWriter;
import java.io.StringWriter;
import java.io.Writer;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Clock;
import java.time.LocalDateTime;
import java.time.format.DateTimeFormatter;
import java.util.Locale;

/**
 * Informe de texto plano de una agregación: cabecera, sesiones con sus conteos y recomendaciones,
 * y resumen final.
 */
public class SessionReportWriter {

    private static final String RULE = "=".repeat(80);
    private static final String THIN_RULE = "-".repeat(80);
    private static final DateTimeFormatter TIMESTAMP = DateTimeFormatter.ofPattern("yyyy-MM-dd HH:mm:ss");

    private final Clock clock;

    public SessionReportWriter() {
        this(Clock.systemDefaultZone());
    }

    public SessionReportWriter(Clock clock) {
        this.clock = clock;
    }

    public void writeTo(AggregationResult result, Path file) throws IOException {
        try (Writer w = Files.newBufferedWriter(file, StandardCharsets.UTF_8)) {
            write(result, w);
        }
    }

    public String toText(AggregationResult result) {
        StringWriter sw = new StringWriter();
        write(result, sw);
        return sw.toString();
    }

    public void write(AggregationResult result, Writer out) {
        PrintWriter w = new PrintWriter(out);
        w.println(RULE);
        w.println("SESSION CALIBRATION REPORT");
        w.println(RULE);
        w.println();
        w.println("Generated: " + LocalDateTime.now(clock).format(TIMESTAMP));
        w.println("Total Sessions: " + result.sessions.size());
        w.println();

        for (SessionAssessment a : result.sessions) {
            writeSession(w, a);
        }

        w.println(RULE);
        w.println("SUMMARY");
        w.println(RULE);
        w.println("Complete Sessions: " + result.completeCount());
        w.println("Partial Sessions: " + result.partialCount());
        w.println("Missing Calibration: " + result.missingCount());
        if (!result.sessions.isEmpty()) {
            w.println(String.format(Locale.US, "Completion Rate: %.1f%%", result.completionRate()));
        }

        AggregationDiagnostics d = result.diagnostics;
        if (d.hasIssues()) {
            w.println();
            w.println("Data Quality:");
            if (d.unassignableLightFrames > 0) {
                w.println("  Light frames without session date: " + d.unassignableLightFrames);
            }
            if (d.mixedBinningSessions > 0) {
                w.println("  Sessions with mixed binning: " + d.mixedBinningSessions);
            }
            for (CalibrationType t : CalibrationType.values()) {
                if (d.unusableCalibration(t) > 0) {
                    w.println("  Unusable " + t.noun() + " frames (missing attributes): " + d.unusableCalibration(t));
                }
            }
        }
        w.flush();
    }

    private void writeSession(PrintWriter w, SessionAssessment a) {
        Session s = a.session;
        w.println(THIN_RULE);
        w.println("Session: " + s.displayName() + (s.instrument != null ? " [" + s.instrument + "]" : ""));
        w.println("Status: " + a.status.label());
        w.println(String.format(Locale.US, "Light Frames: %d | Exposure: %s | Temp: %s | Binning: %s%s",
                s.lightFrameCount, s.exposureLabel(),
                s.avgTemperatureC != null ? String.format(Locale.US, "%.1f°C", s.avgTemperatureC) : "unknown",
                s.binningLabel(), s.mixedBinning ? " (mixed)" : ""));
        w.println();
        w.println(line("Darks (" + s.exposureLabel() + ")", a.darks()));
        w.println(line("Bias", a.bias()));
        w.println(line("Flats (" + (s.filterName != null ? s.filterName : "No Filter") + ")", a.flats()));

        if (!a.recommendations.isEmpty()) {
            w.println();
            w.println("  Recommendations:");
            for (String r : a.recommendations) {
                w.println("    " + r);
            }
        }
        w.println();
    }

    private static String line(String label, CalibrationMatchResult r) {
        StringBuilder sb = new StringBuilder("  ").append(label).append(": ").append(r.frameCount).append(" frames");
        if (r.hasMaster()) sb.append(" + ").append(r.masterCount).append(" master(s)");
        sb.append(" (Quality: ").append(r.qualityScore()).append("%)");
        return sb.toString();
    }
}
