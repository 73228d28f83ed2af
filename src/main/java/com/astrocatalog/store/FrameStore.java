package com.astrocatalog.store;

import com.astrocatalog.model.DateRange;
import com.astrocatalog.model.Frame;

import java.util.List;

/**
 * Acceso de sólo lectura al catálogo de frames. El motor hace como mucho estas dos consultas
 * por agregación, independientemente del tamaño del catálogo.
 */
public interface FrameStore {

    /** Todos los lights cuya fecha de sesión cae en el rango (con rango abierto, también los que no tienen fecha). */
    List<Frame> findLightFrames(DateRange range) throws FrameStoreException;

    /** Darks, bias y flats. El rango sólo filtra los flats; darks y bias son de librería. */
    List<Frame> findCalibrationFrames(DateRange range) throws FrameStoreException;
}
