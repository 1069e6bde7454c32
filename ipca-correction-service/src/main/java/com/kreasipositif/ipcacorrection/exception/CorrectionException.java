package com.kreasipositif.ipcacorrection.exception;

/**
 * Base type for failures raised by the correction workflow.
 */
public class CorrectionException extends RuntimeException {

    public CorrectionException(String message) {
        super(message);
    }

    public CorrectionException(String message, Throwable cause) {
        super(message, cause);
    }
}
