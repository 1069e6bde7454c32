package com.kreasipositif.ipcacorrection.exception;

public class CorrectionSessionNotFoundException extends CorrectionNotFoundException {

    public CorrectionSessionNotFoundException(String sessionId) {
        super("Correction session '%s' not found.".formatted(sessionId));
    }
}
