package com.kreasipositif.ipcacorrection.domain;

public enum ProposalType {
    IPCA_ADDITION,
    IPCA_UPDATE,
    COMPENSATION,
    REACTIVATION,
    DUPLICATA_REMOVAL,
    DUPLICATA_ADJUSTMENT,
    CORRECTION_DATE_CHANGE;

    public boolean isIndexProposal() {
        return this == IPCA_ADDITION || this == IPCA_UPDATE;
    }
}
