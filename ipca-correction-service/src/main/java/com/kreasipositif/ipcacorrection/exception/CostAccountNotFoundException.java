package com.kreasipositif.ipcacorrection.exception;

public class CostAccountNotFoundException extends CorrectionNotFoundException {

    public CostAccountNotFoundException(String entityId) {
        super("Cost account '%s' not found.".formatted(entityId));
    }
}
