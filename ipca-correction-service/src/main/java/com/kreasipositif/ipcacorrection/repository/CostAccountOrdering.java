package com.kreasipositif.ipcacorrection.repository;

import com.kreasipositif.ipcacorrection.domain.CostAccount;

import java.util.Comparator;

public final class CostAccountOrdering {

    public static final Comparator<CostAccount> BY_CONTRACT_FIELD_RECOGNITION = Comparator
            .comparing(CostAccount::getContractCode, Comparator.nullsLast(Comparator.naturalOrder()))
            .thenComparing(CostAccount::getFieldCode, Comparator.nullsLast(Comparator.naturalOrder()))
            .thenComparing(CostAccount::getRecognitionDate, Comparator.nullsLast(Comparator.naturalOrder()));

    private CostAccountOrdering() {
    }
}
