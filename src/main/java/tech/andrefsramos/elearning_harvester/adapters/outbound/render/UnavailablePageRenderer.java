package tech.andrefsramos.elearning_harvester.adapters.outbound.render;

import tech.andrefsramos.elearning_harvester.core.domain.errors.RenderUnavailableException;
import tech.andrefsramos.elearning_harvester.core.ports.PageRenderer;

import java.time.Duration;

/**
 * Renderizador usado quando app.render.enabled=false: falha imediatamente, sem travar.
 */
public class UnavailablePageRenderer implements PageRenderer {

    private final String reason;

    public UnavailablePageRenderer(String reason) {
        this.reason = reason;
    }

    @Override
    public String render(String url, String waitCss, Duration settle) {
        throw new RenderUnavailableException("Renderização indisponível para " + url + ": " + reason);
    }
}
