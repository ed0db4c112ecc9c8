package tech.andrefsramos.elearning_harvester.adapters.outbound.http;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import tech.andrefsramos.elearning_harvester.core.domain.RawResponse;
import tech.andrefsramos.elearning_harvester.core.domain.errors.FetchException;
import tech.andrefsramos.elearning_harvester.core.ports.FetchPort;

import java.io.IOException;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * Finalidade

 * Primitiva de GET resiliente usada por todos os adapters.

 * Principais características:
 * - Cabeçalhos fixos (Accept, Accept-Language, Cache-Control, Pragma) e um User-Agent escolhido
 *   uma única vez na construção; a configuração é imutável e compartilhada entre threads.
 * - Até {@code maxAttempts} tentativas; exceções de rede (inclusive timeout) e status >= 400
 *   são tratados como falhas retentáveis.
 * - Backoff exponencial entre tentativas via {@link BackoffPolicy}.
 * - Esgotadas as tentativas, lança {@link FetchException}.
 */
public final class HttpFetch implements FetchPort {

    private static final Logger log = LoggerFactory.getLogger(HttpFetch.class);

    public static final int DEFAULT_MAX_ATTEMPTS = 3;
    public static final int DEFAULT_TIMEOUT_MS = 30_000;

    static final String ACCEPT =
            "text/html,application/xhtml+xml,application/xml;q=0.9,image/avif,image/webp,*/*;q=0.8";
    static final String DEFAULT_ACCEPT_LANG = "en-US,en;q=0.9";
    private static final String CACHE_NO = "no-cache";

    @FunctionalInterface
    public interface Sleeper {
        void sleep(long ms) throws InterruptedException;
    }

    private final HttpTransport transport;
    private final Map<String, String> headers;
    private final int timeoutMs;
    private final int maxAttempts;
    private final BackoffPolicy backoff;
    private final Sleeper sleeper;

    public HttpFetch(HttpTransport transport, String userAgent, String acceptLanguage,
                     int timeoutMs, int maxAttempts, BackoffPolicy backoff, Sleeper sleeper) {
        this.transport = Objects.requireNonNull(transport, "transport is required");
        this.timeoutMs = timeoutMs > 0 ? timeoutMs : DEFAULT_TIMEOUT_MS;
        this.maxAttempts = Math.max(1, maxAttempts);
        this.backoff = backoff != null ? backoff : BackoffPolicy.defaults();
        this.sleeper = sleeper != null ? sleeper : Thread::sleep;

        Map<String, String> h = new LinkedHashMap<>();
        h.put("User-Agent", userAgent == null || userAgent.isBlank() ? UserAgentProvider.DEFAULT_UA : userAgent);
        h.put("Accept", ACCEPT);
        h.put("Accept-Language", acceptLanguage == null || acceptLanguage.isBlank() ? DEFAULT_ACCEPT_LANG : acceptLanguage);
        h.put("Cache-Control", CACHE_NO);
        h.put("Pragma", CACHE_NO);
        this.headers = Map.copyOf(h);
    }

    public HttpFetch(HttpTransport transport, String userAgent) {
        this(transport, userAgent, DEFAULT_ACCEPT_LANG, DEFAULT_TIMEOUT_MS, DEFAULT_MAX_ATTEMPTS, BackoffPolicy.defaults(), null);
    }

    @Override
    public RawResponse fetch(String url) {
        long globalStart = System.nanoTime();
        log.debug("HttpFetch: iniciando GET url={} timeoutMs={} maxAttempts={}", url, timeoutMs, maxAttempts);

        Integer lastStatus = null;
        String lastError = "sem resposta";
        Throwable lastCause = null;

        for (int attempt = 1; attempt <= maxAttempts; attempt++) {
            if (attempt > 1) {
                long waitMs = backoff.waitMillis(attempt - 1);
                log.debug("HttpFetch: aguardando backoff={}ms antes da tentativa={} url={}", waitMs, attempt, url);
                try {
                    sleeper.sleep(waitMs);
                } catch (InterruptedException ie) {
                    Thread.currentThread().interrupt();
                    throw new FetchException(url, attempt - 1, lastStatus, "interrompido durante o backoff", ie);
                }
            }

            long start = System.nanoTime();
            try {
                RawResponse r = transport.get(url, headers, timeoutMs);
                long elapsedMs = (System.nanoTime() - start) / 1_000_000;
                if (r.isSuccess()) {
                    log.debug("HttpFetch: sucesso tentativa={} url={} status={} elapsedMs={}ms", attempt, url, r.statusCode(), elapsedMs);
                    return r;
                }
                lastStatus = r.statusCode();
                lastError = "HTTP " + r.statusCode();
                lastCause = null;
                log.warn("HttpFetch: status de erro tentativa={}/{} url={} status={} elapsedMs={}ms",
                        attempt, maxAttempts, url, r.statusCode(), elapsedMs);
            } catch (IOException ex) {
                long elapsedMs = (System.nanoTime() - start) / 1_000_000;
                lastError = ex.getClass().getSimpleName() + ": " + ex.getMessage();
                lastCause = ex;
                log.warn("HttpFetch: falha tentativa={}/{} url={} elapsedMs={}ms msg={}",
                        attempt, maxAttempts, url, elapsedMs, lastError);
            } catch (IllegalArgumentException ex) {
                // URL malformada: não é transitório
                throw new FetchException(url, attempt, null, "URL inválida: " + ex.getMessage(), ex);
            }
        }

        long elapsedMs = (System.nanoTime() - globalStart) / 1_000_000;
        log.warn("HttpFetch: falha após todas as tentativas url={} attempts={} elapsedMs={}ms", url, maxAttempts, elapsedMs);
        throw new FetchException(url, maxAttempts, lastStatus, lastError, lastCause);
    }

    public Map<String, String> headers() {
        return headers;
    }

    public int timeoutMs() {
        return timeoutMs;
    }

    public int maxAttempts() {
        return maxAttempts;
    }
}
