package com.kreasipositif.ipcacorrection.domain;

public enum IndexType {
    IPCA,
    IGPM
}
