package com.kreasipositif.ipcacorrection.exception;

public class CorrectionApplyException extends CorrectionException {

    public CorrectionApplyException(String message) {
        super(message);
    }

    public CorrectionApplyException(String message, Throwable cause) {
        super(message, cause);
    }
}
