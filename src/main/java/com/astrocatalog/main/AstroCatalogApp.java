package com.astrocatalog.main;

import com.astrocatalog.ui.CalibrationSessionsTab;
import com.astrocatalog.ui.SettingsTab;
import javafx.application.Application;
import javafx.scene.Scene;
import javafx.scene.control.TabPane;
import javafx.stage.Stage;

public class AstroCatalogApp extends Application {

    private final CalibrationSessionsTab sessionsTab = new CalibrationSessionsTab();

    @Override
    public void start(Stage primaryStage) {
        primaryStage.setTitle("🔭 AstroCatalog - Calibración de Sesiones");

        TabPane tabPane = new TabPane();

        // ORDEN DE PESTAÑAS
        tabPane.getTabs().add(new SettingsTab().create());   // 1. Configurar
        tabPane.getTabs().add(sessionsTab.create());         // 2. Sesiones y calibración
        tabPane.getSelectionModel().select(1);

        Scene scene = new Scene(tabPane, 1100, 800);
        primaryStage.setScene(scene);
        primaryStage.show();
    }

    @Override
    public void stop() {
        sessionsTab.dispose();
    }

    public static void main(String[] args) {
        launch(args);
    }
}
