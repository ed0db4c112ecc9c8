package tech.andrefsramos.elearning_harvester.core.domain;

import lombok.Builder;

/*
 * Finalidade

 * Registro normalizado de um curso coletado de uma fonte. Todos os campos opcionais
 * podem ser nulos: nulo significa "não extraído", nunca "sabidamente vazio".

 * Regras
 * - {@code provider} é sempre preenchido pelo adapter com o seu displayName.
 * - {@code id} é estável dentro da fonte (normalmente a URL canônica); não é único globalmente.
 * - Imutável: construído apenas dentro da rotina de extração de um adapter.
 */
@Builder(toBuilder = true)
public record CourseRecord(
        String id,
        String title,
        String url,
        Boolean isPaid,
        String price,
        Integer numSubscribers,
        Integer numReviews,
        Integer numLectures,
        String level,
        String contentDuration,
        String publishedTimestamp,
        String subject,
        String provider,
        String language
) {

    public boolean isValid() {
        return provider != null && !provider.isBlank() && url != null && !url.isBlank();
    }
}
