package tech.andrefsramos.elearning_harvester.core.domain;

import java.util.List;

/*
 * Finalidade

 * Consolidação de uma rodada: outcomes na ordem de registro dos adapters e a concatenação
 * dos registros produzidos (sem deduplicação entre fontes).
 */
public record RunReport(List<SourceOutcome> outcomes, long elapsedMs) {

    public RunReport {
        outcomes = outcomes == null ? List.of() : List.copyOf(outcomes);
    }

    public List<CourseRecord> records() {
        return outcomes.stream()
                .flatMap(o -> o.records().stream())
                .toList();
    }

    public long count(OutcomeStatus status) {
        return outcomes.stream().filter(o -> o.status() == status).count();
    }
}
