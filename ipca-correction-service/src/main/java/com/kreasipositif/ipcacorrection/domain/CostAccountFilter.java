package com.kreasipositif.ipcacorrection.domain;

import lombok.Builder;
import lombok.Value;

/**
 * Optional criteria for selecting cost accounts; null fields match everything.
 */
@Value
@Builder
public class CostAccountFilter {

    String entityId;
    String contractCode;
    String fieldCode;
    String expenseOrigin;

    public static CostAccountFilter all() {
        return CostAccountFilter.builder().build();
    }

    public boolean matches(CostAccount account) {
        return (entityId == null || entityId.equals(account.getId()))
                && (contractCode == null || contractCode.equals(account.getContractCode()))
                && (fieldCode == null || fieldCode.equals(account.getFieldCode()))
                && (expenseOrigin == null || expenseOrigin.equals(account.getExpenseOrigin()));
    }
}
