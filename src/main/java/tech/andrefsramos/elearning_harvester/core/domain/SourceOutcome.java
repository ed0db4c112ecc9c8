package tech.andrefsramos.elearning_harvester.core.domain;

import java.util.List;

/*
 * Finalidade

 * Resultado da execução de um adapter dentro de uma rodada. Só SUCCEEDED carrega registros;
 * os demais estados contribuem com zero registros.
 */
public record SourceOutcome(
        String key,
        String displayName,
        OutcomeStatus status,
        List<CourseRecord> records,
        String error,
        long elapsedMs
) {

    public SourceOutcome {
        records = records == null ? List.of() : List.copyOf(records);
    }

    public static SourceOutcome succeeded(String key, String displayName, List<CourseRecord> records, long elapsedMs) {
        return new SourceOutcome(key, displayName, OutcomeStatus.SUCCEEDED, records, null, elapsedMs);
    }

    public static SourceOutcome failed(String key, String displayName, String error, long elapsedMs) {
        return new SourceOutcome(key, displayName, OutcomeStatus.FAILED, List.of(), error, elapsedMs);
    }

    public static SourceOutcome skipped(String key, String displayName) {
        return new SourceOutcome(key, displayName, OutcomeStatus.SKIPPED, List.of(), null, 0);
    }

    public static SourceOutcome cancelled(String key, String displayName) {
        return new SourceOutcome(key, displayName, OutcomeStatus.CANCELLED, List.of(), null, 0);
    }

    public static SourceOutcome abandoned(String key, String displayName, long elapsedMs) {
        return new SourceOutcome(key, displayName, OutcomeStatus.ABANDONED, List.of(),
                "abandonado após o período de graça", elapsedMs);
    }
}
