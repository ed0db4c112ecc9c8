package tech.andrefsramos.elearning_harvester.adapters.outbound.http;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.concurrent.ThreadLocalRandom;
import java.util.function.Supplier;

/*
 * Finalidade

 * Escolhe o User-Agent do processo. A escolha é feita uma vez (na montagem do {@link HttpFetch})
 * e qualquer falha na rotação cai silenciosamente no UA padrão.
 */
public final class UserAgentProvider {

    private static final Logger log = LoggerFactory.getLogger(UserAgentProvider.class);

    public static final String DEFAULT_UA = "Mozilla/5.0";

    static final List<String> POOL = List.of(
            "Mozilla/5.0 (Windows NT 10.0; Win64; x64) AppleWebKit/537.36 (KHTML, like Gecko) Chrome/124.0.0.0 Safari/537.36",
            "Mozilla/5.0 (Windows NT 10.0; Win64; x64) AppleWebKit/537.36 (KHTML, like Gecko) Chrome/122.0.0.0 Safari/537.36",
            "Mozilla/5.0 (Macintosh; Intel Mac OS X 10_15_7) AppleWebKit/605.1.15 (KHTML, like Gecko) Version/17.4 Safari/605.1.15",
            "Mozilla/5.0 (X11; Linux x86_64; rv:125.0) Gecko/20100101 Firefox/125.0",
            "Mozilla/5.0 (Windows NT 10.0; Win64; x64; rv:124.0) Gecko/20100101 Firefox/124.0"
    );

    private final Supplier<String> chooser;

    public UserAgentProvider() {
        this(() -> POOL.get(ThreadLocalRandom.current().nextInt(POOL.size())));
    }

    public UserAgentProvider(Supplier<String> chooser) {
        this.chooser = chooser;
    }

    /** UA fixo configurado tem precedência; vazio = rotação. */
    public String select(String configured) {
        if (configured != null && !configured.isBlank()) {
            return configured.trim();
        }
        try {
            String ua = chooser.get();
            if (ua != null && !ua.isBlank()) {
                return ua;
            }
        } catch (RuntimeException e) {
            log.debug("UserAgentProvider: rotação falhou, usando UA padrão. causa={}", e.toString());
        }
        return DEFAULT_UA;
    }
}
