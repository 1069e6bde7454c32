package com.kreasipositif.ipcacorrection.exception;

public abstract class CorrectionNotFoundException extends CorrectionException {

    protected CorrectionNotFoundException(String message) {
        super(message);
    }
}
