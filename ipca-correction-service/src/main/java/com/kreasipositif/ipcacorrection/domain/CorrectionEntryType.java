package com.kreasipositif.ipcacorrection.domain;

import java.util.Optional;

/**
 * Kind of an entry in a cost account's correction timeline.
 */
public enum CorrectionEntryType {
    IPCA,
    IGPM,
    RETIFICACAO,
    RECUPERACAO,
    INVALIDACAO_RECONHECIMENTO_PARCIAL,
    COMPENSATION,
    REACTIVATION;

    public boolean isIndexCorrection() {
        return this == IPCA || this == IGPM;
    }

    /** Index used to look up the historical rate of this entry; non-index entries have none. */
    public Optional<IndexType> indexType() {
        return switch (this) {
            case IPCA -> Optional.of(IndexType.IPCA);
            case IGPM -> Optional.of(IndexType.IGPM);
            default -> Optional.empty();
        };
    }
}
