package com.astrocatalog.store;

public class FrameStoreException extends Exception {

    public FrameStoreException(String message) {
        super(message);
    }

    public FrameStoreException(String message, Throwable cause) {
        super(message, cause);
    }
}
