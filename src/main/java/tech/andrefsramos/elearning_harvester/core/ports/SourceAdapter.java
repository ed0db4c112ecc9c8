package tech.andrefsramos.elearning_harvester.core.ports;

import tech.andrefsramos.elearning_harvester.core.domain.CourseRecord;

import java.util.stream.Stream;

/*
 * Finalidade

 * Capacidade de extração de uma fonte (plataforma). Cada fonte registrada é uma instância
 * que implementa esta interface; não há hierarquia de classes base entre os adapters.

 * Contrato
 * - key(): identificador estável, minúsculo, único no registro.
 * - displayName(): copiado literalmente no campo provider de cada registro.
 * - isAllowed(): gate de política (robots/ToS, domínio pendente de configuração). false = SKIPPED.
 * - iterCourses(): sequência finita e não reiniciável. Erros por item são tratados internamente;
 *   falha integral sobe como AdapterException.
 */
public interface SourceAdapter {

    String key();

    String displayName();

    String baseUrl();

    default boolean requiresRendering() {
        return false;
    }

    default boolean isAllowed() {
        return true;
    }

    Stream<CourseRecord> iterCourses();
}
