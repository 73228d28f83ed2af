package com.astrocatalog.ui;

import com.astrocatalog.model.AppConfig;
import com.astrocatalog.model.CalibrationSettings;
import javafx.geometry.Insets;
import javafx.geometry.Pos;
import javafx.scene.control.*;
import javafx.scene.layout.*;
import javafx.scene.text.Font;
import javafx.scene.text.FontWeight;
import javafx.stage.DirectoryChooser;
import java.io.File;
import java.util.Locale;

public class SettingsTab {

    // UI Controls
    private TextField txtCatalogDir;
    private CheckBox chkRecursive;
    private TextField txtTolDarks, txtTolBias, txtTolFlats, txtTolExposure;
    private TextField txtRecommended, txtAcceptable;
    private CheckBox chkMasters, chkCache;
    private Label lblResults;

    public Tab create() {
        Tab tab = new Tab("⚙️ Configuración");
        BorderPane root = new BorderPane();
        root.setPadding(new Insets(20));

        VBox content = new VBox(20);
        content.setAlignment(Pos.TOP_CENTER);
        content.setMaxWidth(700);

        Label title = new Label("🔭 Configuración Global");
        title.setFont(Font.font("System", FontWeight.BOLD, 20));

        // --- 1. CATÁLOGO ---
        VBox catalogBox = new VBox(10);
        catalogBox.setStyle("-fx-border-color: #FF9800; -fx-border-width: 1; -fx-padding: 15; -fx-background-radius: 5; -fx-background-color: #FFF3E0;");
        Label lblCatalog = new Label("🗂️ Catálogo FITS");
        lblCatalog.setFont(Font.font("System", FontWeight.BOLD, 13));

        txtCatalogDir = new TextField(AppConfig.getCatalogDirectory());
        txtCatalogDir.setPromptText("Carpeta con lights y calibración");
        txtCatalogDir.setPrefWidth(300);
        Button btnFindDir = new Button("📂 Carpeta");
        btnFindDir.setOnAction(e -> browseDir(txtCatalogDir));
        chkRecursive = new CheckBox("Incluir subcarpetas");
        chkRecursive.setSelected(AppConfig.isCatalogRecursive());

        catalogBox.getChildren().addAll(lblCatalog, new HBox(10, txtCatalogDir, btnFindDir), chkRecursive);

        // --- 2. TOLERANCIAS ---
        GridPane gridTol = new GridPane();
        gridTol.setHgap(15); gridTol.setVgap(15);
        gridTol.setStyle("-fx-border-color: #CCC; -fx-padding: 15; -fx-background-color: #F9F9F9; -fx-background-radius: 5;");

        txtTolDarks = number(AppConfig.getTempToleranceDarks());
        txtTolBias = number(AppConfig.getTempToleranceBias());
        txtTolFlats = number(AppConfig.getTempToleranceFlats());
        txtTolExposure = number(AppConfig.getExposureTolerance());

        gridTol.add(new Label("Tolerancia Temp. Darks (°C):"), 0, 0); gridTol.add(txtTolDarks, 1, 0);
        gridTol.add(new Label("Tolerancia Temp. Bias (°C):"), 0, 1); gridTol.add(txtTolBias, 1, 1);
        gridTol.add(new Label("Tolerancia Temp. Flats (°C):"), 0, 2); gridTol.add(txtTolFlats, 1, 2);
        gridTol.add(new Label("Tolerancia Exposición (s):"), 0, 3); gridTol.add(txtTolExposure, 1, 3);

        // --- 3. UMBRALES DE CALIDAD ---
        VBox qualityBox = new VBox(10);
        qualityBox.setStyle("-fx-border-color: #2196F3; -fx-border-width: 1; -fx-padding: 15; -fx-background-radius: 5; -fx-background-color: #E3F2FD;");
        Label lblQuality = new Label("🎯 Umbrales de Calidad");
        lblQuality.setFont(Font.font("System", FontWeight.BOLD, 13));

        GridPane gridQ = new GridPane();
        gridQ.setHgap(10); gridQ.setVgap(10);
        txtRecommended = new TextField(String.valueOf(AppConfig.getMinFramesRecommended())); txtRecommended.setPrefWidth(60);
        txtAcceptable = new TextField(String.valueOf(AppConfig.getMinFramesAcceptable())); txtAcceptable.setPrefWidth(60);
        gridQ.add(new Label("Frames recomendados (100%):"), 0, 0); gridQ.add(txtRecommended, 1, 0);
        gridQ.add(new Label("Mínimo aceptable:"), 0, 1); gridQ.add(txtAcceptable, 1, 1);

        chkMasters = new CheckBox("Contar master frames");
        chkMasters.setSelected(AppConfig.isIncludeMasters());
        chkCache = new CheckBox("Usar caché de calibración (recomendado)");
        chkCache.setTooltip(new Tooltip("Desactivar sólo para validar en catálogos pequeños (escaneo directo)."));
        chkCache.setSelected(AppConfig.isUseCache());

        qualityBox.getChildren().addAll(lblQuality, gridQ, chkMasters, chkCache);

        // --- FOOTER ---
        lblResults = new Label("");
        lblResults.setStyle("-fx-font-weight: bold; -fx-text-fill: #2E7D32;");

        Button btnDefaults = new Button("↩️ Valores por defecto");
        btnDefaults.setOnAction(e -> loadDefaults());

        Button btnSave = new Button("💾 Guardar TODO");
        btnSave.setStyle("-fx-base: #4CAF50; -fx-text-fill: white; -fx-font-weight: bold; -fx-font-size: 14px;");
        btnSave.setMaxWidth(Double.MAX_VALUE);
        btnSave.setOnAction(e -> saveAllConfig());

        content.getChildren().addAll(title, catalogBox, gridTol, qualityBox, btnDefaults, btnSave, lblResults);

        // Scroll pane por si la pantalla es chica
        ScrollPane scroll = new ScrollPane(content);
        scroll.setFitToWidth(true);
        scroll.setStyle("-fx-background-color:transparent;");

        root.setCenter(scroll);
        tab.setContent(root);
        return tab;
    }

    private static TextField number(double v) {
        TextField tf = new TextField(String.format(Locale.US, "%.1f", v));
        tf.setPrefWidth(60);
        return tf;
    }

    private void browseDir(TextField tf) {
        DirectoryChooser dc = new DirectoryChooser();
        File f = dc.showDialog(tf.getScene().getWindow());
        if(f != null) tf.setText(f.getAbsolutePath());
    }

    private void loadDefaults() {
        CalibrationSettings d = CalibrationSettings.defaults();
        txtTolDarks.setText(String.format(Locale.US, "%.1f", d.tempToleranceDarks));
        txtTolBias.setText(String.format(Locale.US, "%.1f", d.tempToleranceBias));
        txtTolFlats.setText(String.format(Locale.US, "%.1f", d.tempToleranceFlats));
        txtTolExposure.setText(String.format(Locale.US, "%.1f", d.exposureTolerance));
        txtRecommended.setText(String.valueOf(d.recommendedFrames));
        txtAcceptable.setText(String.valueOf(d.acceptableFrames));
        chkMasters.setSelected(d.includeMasters);
        chkCache.setSelected(d.useCache);
    }

    private void saveAllConfig() {
        try {
            // Validamos construyendo la configuración antes de guardar nada
            CalibrationSettings s = new CalibrationSettings(
                    Double.parseDouble(txtTolDarks.getText()), Double.parseDouble(txtTolBias.getText()),
                    Double.parseDouble(txtTolFlats.getText()), Double.parseDouble(txtTolExposure.getText()),
                    Integer.parseInt(txtRecommended.getText().trim()), Integer.parseInt(txtAcceptable.getText().trim()),
                    chkMasters.isSelected(), chkCache.isSelected());

            AppConfig.setTempToleranceDarks(s.tempToleranceDarks);
            AppConfig.setTempToleranceBias(s.tempToleranceBias);
            AppConfig.setTempToleranceFlats(s.tempToleranceFlats);
            AppConfig.setExposureTolerance(s.exposureTolerance);
            AppConfig.setMinFramesRecommended(s.recommendedFrames);
            AppConfig.setMinFramesAcceptable(s.acceptableFrames);
            AppConfig.setIncludeMasters(s.includeMasters);
            AppConfig.setUseCache(s.useCache);

            AppConfig.setCatalogDirectory(txtCatalogDir.getText());
            AppConfig.setCatalogRecursive(chkRecursive.isSelected());

            lblResults.setText("✅ Configuración Guardada (se aplica en la próxima actualización)");
        } catch (NumberFormatException e) {
            lblResults.setText("❌ Error en números");
        } catch (IllegalArgumentException e) {
            lblResults.setText("❌ " + e.getMessage());
        }
    }
}
