package com.astrocatalog.service;

import com.astrocatalog.model.AggregationResult;
import com.astrocatalog.store.FrameStoreException;

/**
 * Canal de salida de una agregación. Se llama desde el hilo de fondo; la interfaz gráfica debe
 * pasar a su propio hilo (Platform.runLater).
 */
public interface AggregationListener {

    default void onProgress(long runId, int processed, int total, String message) {}

    void onCompleted(AggregationResult result);

    void onFailed(long runId, FrameStoreException error);
}
