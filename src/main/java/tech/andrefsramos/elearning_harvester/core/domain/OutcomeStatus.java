package tech.andrefsramos.elearning_harvester.core.domain;

public enum OutcomeStatus {
    SUCCEEDED,
    FAILED,
    /** isAllowed() == false: a fonte não foi executada. */
    SKIPPED,
    /** Não iniciada porque o sinal de cancelamento já estava ativo. */
    CANCELLED,
    /** Em execução quando o período de graça expirou. */
    ABANDONED
}
