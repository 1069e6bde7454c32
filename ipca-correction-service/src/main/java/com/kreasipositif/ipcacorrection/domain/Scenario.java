package com.kreasipositif.ipcacorrection.domain;

/**
 * Correction scenario detected for a cost account.
 */
public enum Scenario {
    /** Gaps only; nothing applied after them. */
    CENARIO_0,
    /** Gaps followed by later or late index corrections that used a wrong base. */
    CENARIO_1,
    /** Gaps or late corrections on an account that was later recovered. */
    CENARIO_2,
    CENARIO_DUPLICATAS,
    CENARIO_CORRECAO_FORA_APENAS,
    CENARIO_COMPLEXO,
    CENARIO_IPCA_VIGENTE;

    /** Whether the engine computes proposals for this scenario. */
    public boolean isAutoCorrectable() {
        return this != CENARIO_CORRECAO_FORA_APENAS && this != CENARIO_COMPLEXO;
    }
}
