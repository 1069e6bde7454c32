package com.kreasipositif.ipcacorrection.domain;

public enum SessionStatus {
    ANALYZING,
    PREVIEW,
    APPROVED,
    APPLIED,
    REJECTED,
    ERROR
}
