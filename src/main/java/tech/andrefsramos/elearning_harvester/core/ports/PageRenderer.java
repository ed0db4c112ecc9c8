package tech.andrefsramos.elearning_harvester.core.ports;

import java.time.Duration;

public interface PageRenderer {

    /**
     * Retorna o HTML completamente renderizado da página.
     *
     * @param waitCss seletor CSS que precisa existir antes da captura (opcional)
     * @param settle  espera fixa após o carregamento
     * @throws tech.andrefsramos.elearning_harvester.core.domain.errors.RenderUnavailableException se o navegador não estiver disponível
     */
    String render(String url, String waitCss, Duration settle);
}
