package tech.andrefsramos.elearning_harvester.adapters.outbound.scrapers;

import java.net.URI;
import java.util.Locale;

/**
 * Identidade e configuração efetiva de uma fonte: key, nome exibido, URL base (já com
 * override aplicado) e flag de habilitação.
 */
public record SourceDescriptor(String key, String displayName, String baseUrl, boolean enabled) {

    static final String PLACEHOLDER_TLD = ".example";

    /** Domínios *.example ainda não foram confirmados; a fonte fica fora até ser configurada. */
    public boolean isPlaceholder() {
        try {
            String host = URI.create(baseUrl).getHost();
            return host == null || host.toLowerCase(Locale.ROOT).endsWith(PLACEHOLDER_TLD);
        } catch (IllegalArgumentException e) {
            return true;
        }
    }

    public boolean allowed() {
        return enabled && !isPlaceholder();
    }
}
