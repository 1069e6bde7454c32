package com.kreasipositif.ipcacorrection.exception;

/**
 * A request that was refused before any state was changed.
 */
public class CorrectionValidationException extends CorrectionException {

    public CorrectionValidationException(String message) {
        super(message);
    }
}
