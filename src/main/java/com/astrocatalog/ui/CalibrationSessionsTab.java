package com.astrocatalog.ui;

import com.astrocatalog.model.AggregationDiagnostics;
import com.astrocatalog.model.AggregationResult;
import com.astrocatalog.model.AppConfig;
import com.astrocatalog.model.CalibrationType;
import com.astrocatalog.model.SessionAssessment;
import com.astrocatalog.model.SessionStatus;
import com.astrocatalog.service.AggregationController;
import com.astrocatalog.service.AggregationListener;
import com.astrocatalog.service.SessionReportWriter;
import com.astrocatalog.store.FitsDirectoryFrameStore;
import com.astrocatalog.store.FrameStoreException;
import javafx.application.Platform;
import javafx.beans.property.ReadOnlyObjectWrapper;
import javafx.beans.property.ReadOnlyStringWrapper;
import javafx.geometry.Insets;
import javafx.geometry.Orientation;
import javafx.geometry.Pos;
import javafx.scene.control.*;
import javafx.scene.layout.*;
import javafx.stage.FileChooser;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import java.io.File;
import java.nio.file.Paths;
import java.util.Locale;
import java.util.function.Function;

public class CalibrationSessionsTab {

    private static final Logger logger = LoggerFactory.getLogger(CalibrationSessionsTab.class);

    private final SessionReportWriter reportWriter = new SessionReportWriter();

    private AggregationController controller;
    private String controllerDir;

    // UI Controls
    private ComboBox<String> cmbStatus;
    private TableView<SessionAssessment> table;
    private TextArea detailsArea;
    private TextArea logArea;
    private ProgressBar progressBar;
    private Button btnRefresh, btnStop, btnExport;

    // Stats UI Controls
    private Label lblStatTotal, lblStatComplete, lblStatPartial, lblStatMissing, lblStatRate;
    private Label lblStatUnassignable, lblStatUnusable, lblStatMixed;

    public Tab create() {
        Tab tab = new Tab("📋 Sesiones");
        BorderPane root = new BorderPane();
        root.setPadding(new Insets(15));

        HBox controls = new HBox(10);
        controls.setAlignment(Pos.CENTER_LEFT);
        cmbStatus = new ComboBox<>();
        cmbStatus.getItems().addAll("All", "Complete", "Partial", "Missing");
        cmbStatus.setValue("All");
        cmbStatus.setOnAction(e -> applyFilter());

        btnRefresh = new Button("🔄 Actualizar");
        btnRefresh.setStyle("-fx-base: #4CAF50; -fx-text-fill: white; -fx-font-weight: bold;");
        btnRefresh.setOnAction(e -> refresh());
        btnStop = new Button("🛑 DETENER");
        btnStop.setStyle("-fx-base: #F44336; -fx-text-fill: white; -fx-font-weight: bold;");
        btnStop.setDisable(true);
        btnStop.setOnAction(e -> detenerProceso());
        btnExport = new Button("📄 Exportar Informe");
        btnExport.setDisable(true);
        btnExport.setOnAction(e -> exportReport());

        controls.getChildren().addAll(new Label("Estado:"), cmbStatus, btnRefresh, btnStop, btnExport);

        // --- TABLA DE SESIONES ---
        table = new TableView<>();
        table.setColumnResizePolicy(TableView.CONSTRAINED_RESIZE_POLICY);
        table.getColumns().add(column("Sesión", a -> a.session.displayName()));
        table.getColumns().add(column("Estado", a -> a.status.label()));
        TableColumn<SessionAssessment, Number> colLights = new TableColumn<>("Lights");
        colLights.setCellValueFactory(c -> new ReadOnlyObjectWrapper<>(c.getValue().session.lightFrameCount));
        table.getColumns().add(colLights);
        table.getColumns().add(column("Darks", a -> a.darks().displayText()));
        table.getColumns().add(column("Bias", a -> a.bias().displayText()));
        table.getColumns().add(column("Flats", a -> a.flats().displayText()));
        table.getSelectionModel().selectedItemProperty().addListener((obs, old, sel) -> showDetails(sel));

        detailsArea = new TextArea();
        detailsArea.setEditable(false);
        detailsArea.setStyle("-fx-font-family: 'monospaced'; -fx-font-size: 11px;");
        logArea = new TextArea();
        logArea.setEditable(false);
        logArea.setPrefRowCount(4);
        logArea.setStyle("-fx-font-family: 'monospaced'; -fx-font-size: 11px;");

        SplitPane center = new SplitPane();
        center.setOrientation(Orientation.VERTICAL);
        center.getItems().addAll(table, detailsArea, logArea);
        center.setDividerPositions(0.55, 0.85);

        // --- STATS DASHBOARD ---
        VBox statsPanel = new VBox(10);
        statsPanel.setPadding(new Insets(10));
        statsPanel.setPrefWidth(220);
        statsPanel.setStyle("-fx-background-color: #f4f4f4; -fx-border-color: #ccc; -fx-border-width: 0 0 0 1;");
        Label lblTitleStats = new Label("📊 Estadísticas");
        lblTitleStats.setStyle("-fx-font-weight: bold; -fx-font-size: 14px; -fx-text-fill: #2c3e50;");

        lblStatTotal = new Label("Sesiones: -");
        lblStatComplete = new Label("✅ Completas: -"); lblStatComplete.setStyle("-fx-text-fill: green;");
        lblStatPartial = new Label("⚠️ Parciales: -"); lblStatPartial.setStyle("-fx-text-fill: #E65100;");
        lblStatMissing = new Label("❌ Sin calibración: -"); lblStatMissing.setStyle("-fx-text-fill: red;");
        lblStatRate = new Label("Completado: -");

        VBox qualBox = new VBox(5);
        qualBox.setStyle("-fx-padding: 8; -fx-background-color: white; -fx-background-radius: 5; -fx-effect: dropshadow(three-pass-box, rgba(0,0,0,0.1), 3, 0, 0, 1);");
        lblStatUnassignable = new Label("Lights sin fecha: -");
        lblStatUnusable = new Label("Calibración inservible: -");
        lblStatMixed = new Label("Binning mixto: -");
        qualBox.getChildren().addAll(new Label("Calidad de datos:"), new Separator(), lblStatUnassignable, lblStatUnusable, lblStatMixed);

        statsPanel.getChildren().addAll(lblTitleStats, lblStatTotal, lblStatComplete, lblStatPartial, lblStatMissing, lblStatRate, new Separator(), qualBox);

        SplitPane splitPane = new SplitPane();
        splitPane.getItems().addAll(center, statsPanel);
        splitPane.setDividerPositions(0.78);

        progressBar = new ProgressBar(0);
        progressBar.setMaxWidth(Double.MAX_VALUE);

        root.setTop(new VBox(10, controls, new Separator()));
        root.setCenter(splitPane);
        root.setBottom(new VBox(5, progressBar));

        tab.setContent(root);
        return tab;
    }

    private static TableColumn<SessionAssessment, String> column(String title, Function<SessionAssessment, String> f) {
        TableColumn<SessionAssessment, String> col = new TableColumn<>(title);
        col.setCellValueFactory(c -> new ReadOnlyStringWrapper(f.apply(c.getValue())));
        return col;
    }

    private AggregationController controller() {
        String dir = AppConfig.getCatalogDirectory();
        if (controller == null || !dir.equals(controllerDir)) {
            AggregationResult previous = null;
            if (controller != null) {
                // El resultado de la carpeta anterior sigue visible hasta que haya uno nuevo
                previous = controller.getLastResult();
                controller.close();
            }
            controller = new AggregationController(
                    new FitsDirectoryFrameStore(Paths.get(dir), AppConfig.isCatalogRecursive()),
                    AppConfig::toCalibrationSettings, previous);
            controllerDir = dir;
        }
        return controller;
    }

    private void refresh() {
        if (AppConfig.getCatalogDirectory().isEmpty()) {
            logArea.appendText("⚠️ Selecciona la carpeta del catálogo en Configuración.\n");
            return;
        }
        btnStop.setDisable(false);
        progressBar.setProgress(ProgressBar.INDETERMINATE_PROGRESS);
        logArea.appendText("📡 Analizando sesiones...\n");

        controller().refresh(new AggregationListener() {
            @Override
            public void onProgress(long runId, int processed, int total, String message) {
                Platform.runLater(() -> {
                    if (total > 0) progressBar.setProgress((double) processed / total);
                    if (processed == 0) logArea.appendText(message + "\n");
                });
            }

            @Override
            public void onCompleted(AggregationResult result) {
                Platform.runLater(() -> {
                    btnStop.setDisable(true);
                    btnExport.setDisable(false);
                    progressBar.setProgress(1);
                    logArea.appendText("🏁 " + result.sessions.size() + " sesiones.\n");
                    showResult(result);
                });
            }

            @Override
            public void onFailed(long runId, FrameStoreException error) {
                // El resultado anterior sigue en pantalla
                Platform.runLater(() -> {
                    btnStop.setDisable(true);
                    progressBar.setProgress(0);
                    logArea.appendText("❌ Error: " + error.getMessage() + "\n");
                });
            }
        });
    }

    private void detenerProceso() {
        btnStop.setDisable(true);
        if (controller != null) controller.cancel();
        progressBar.setProgress(0);
        logArea.appendText("🛑 Detenido.\n");
    }

    private void applyFilter() {
        if (controller != null && controller.getLastResult() != null) showResult(controller.getLastResult());
    }

    private SessionStatus selectedStatus() {
        switch (cmbStatus.getValue()) {
            case "Complete": return SessionStatus.COMPLETE;
            case "Partial": return SessionStatus.PARTIAL;
            case "Missing": return SessionStatus.MISSING;
            default: return null;
        }
    }

    private void showResult(AggregationResult result) {
        table.getItems().setAll(result.filterByStatus(selectedStatus()));
        lblStatTotal.setText("Sesiones: " + result.sessions.size());
        lblStatComplete.setText("✅ Completas: " + result.completeCount());
        lblStatPartial.setText("⚠️ Parciales: " + result.partialCount());
        lblStatMissing.setText("❌ Sin calibración: " + result.missingCount());
        lblStatRate.setText(String.format(Locale.US, "Completado: %.1f%%", result.completionRate()));

        AggregationDiagnostics d = result.diagnostics;
        lblStatUnassignable.setText("Lights sin fecha: " + d.unassignableLightFrames);
        lblStatUnusable.setText("Calibración inservible: " + d.unusableCalibrationTotal());
        lblStatMixed.setText("Binning mixto: " + d.mixedBinningSessions);
    }

    private void showDetails(SessionAssessment a) {
        if (a == null) { detailsArea.clear(); return; }
        StringBuilder sb = new StringBuilder();
        sb.append("Sesión: ").append(a.session.displayName()).append('\n');
        sb.append("Instrumento: ").append(a.session.instrument != null ? a.session.instrument : "-").append('\n');
        sb.append("Estado: ").append(a.status.label()).append('\n');
        sb.append(String.format(Locale.US, "Lights: %d | %s | %s | %s%n", a.session.lightFrameCount,
                a.session.exposureLabel(), a.session.temperatureLabel(), a.session.binningLabel()));
        for (CalibrationType t : CalibrationType.values()) {
            sb.append(String.format("%-6s %s (Calidad: %d%%)%n", t.label() + ":", a.match(t).displayText(), a.match(t).qualityScore()));
        }
        if (!a.recommendations.isEmpty()) {
            sb.append("\nRecomendaciones:\n");
            for (String r : a.recommendations) sb.append("• ").append(r).append('\n');
        }
        detailsArea.setText(sb.toString());
    }

    private void exportReport() {
        AggregationResult result = controller != null ? controller.getLastResult() : null;
        if (result == null) return;
        FileChooser fc = new FileChooser();
        fc.setInitialFileName("session_report.txt");
        fc.getExtensionFilters().add(new FileChooser.ExtensionFilter("Texto", "*.txt"));
        File f = fc.showSaveDialog(table.getScene().getWindow());
        if (f == null) return;
        try {
            reportWriter.writeTo(result, f.toPath());
            logArea.appendText("✅ Informe exportado: " + f.getAbsolutePath() + "\n");
        } catch (Exception e) {
            logger.error("No se pudo exportar el informe a {}", f, e);
            logArea.appendText("❌ Error al exportar: " + e.getMessage() + "\n");
        }
    }

    public void dispose() {
        if (controller != null) controller.close();
    }
}
