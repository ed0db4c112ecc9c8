package tech.andrefsramos.elearning_harvester.core.ports;

import tech.andrefsramos.elearning_harvester.core.domain.RawResponse;

public interface FetchPort {

    /**
     * GET resiliente. Retorna apenas respostas com status &lt; 400.
     *
     * @throws tech.andrefsramos.elearning_harvester.core.domain.errors.FetchException após esgotar as tentativas
     */
    RawResponse fetch(String url);
}
