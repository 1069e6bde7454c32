package com.kreasipositif.ipcacorrection.domain;

public enum GapPriority {
    ALTA,
    MEDIA,
    BAIXA
}
