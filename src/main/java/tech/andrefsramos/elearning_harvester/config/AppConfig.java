package tech.andrefsramos.elearning_harvester.config;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.core.env.Environment;
import tech.andrefsramos.elearning_harvester.adapters.inbound.cli.HarvestCommand;
import tech.andrefsramos.elearning_harvester.adapters.outbound.http.BackoffPolicy;
import tech.andrefsramos.elearning_harvester.adapters.outbound.http.HttpFetch;
import tech.andrefsramos.elearning_harvester.adapters.outbound.http.JsoupHttpTransport;
import tech.andrefsramos.elearning_harvester.adapters.outbound.http.UserAgentProvider;
import tech.andrefsramos.elearning_harvester.adapters.outbound.render.SeleniumPageRenderer;
import tech.andrefsramos.elearning_harvester.adapters.outbound.render.UnavailablePageRenderer;
import tech.andrefsramos.elearning_harvester.adapters.outbound.scrapers.LinkDiscovery;
import tech.andrefsramos.elearning_harvester.adapters.outbound.scrapers.SourceCatalog;
import tech.andrefsramos.elearning_harvester.adapters.outbound.sink.CsvCourseSink;
import tech.andrefsramos.elearning_harvester.core.application.AdapterRegistry;
import tech.andrefsramos.elearning_harvester.core.application.RunCoursesUseCase;
import tech.andrefsramos.elearning_harvester.core.application.impl.RunControllerService;
import tech.andrefsramos.elearning_harvester.core.ports.CourseSink;
import tech.andrefsramos.elearning_harvester.core.ports.FetchPort;
import tech.andrefsramos.elearning_harvester.core.ports.PageRenderer;

import java.nio.file.Path;
import java.time.Duration;

/*
 * Finalidade

 * Orquestra a composição dos casos de uso (UseCases) e portas (Ports), criando beans Spring
 * com dependências explicitadas via construtor. Centraliza os parâmetros de execução obtidos
 * via propriedades (application.yml / env).

 * Visão Geral dos Beans

 * - FetchPort (HttpFetch): GET com cabeçalhos fixos, UA escolhido uma vez por processo,
 *   timeout e backoff exponencial configuráveis.
 * - PageRenderer: Selenium (Chrome headless) quando app.render.enabled=true; caso contrário
 *   um renderizador que falha imediatamente com erro de configuração.
 * - LinkDiscovery: heurística de descoberta de links compartilhada pelos adapters.
 * - AdapterRegistry: montado uma única vez a partir da lista explícita do SourceCatalog.
 * - RunCoursesUseCase: controlador de execução (isolamento, concorrência, cancelamento).
 * - CourseSink: gravação atômica do CSV.
 * - HarvestCommand: CLI picocli executada pelo HarvestCommandRunner.
 */
@Configuration
public class AppConfig {

    private static final Logger log = LoggerFactory.getLogger(AppConfig.class);

    /* ============================= FetchPort ============================= */

    @Bean
    FetchPort fetchPort(
            @Value("${app.fetch.user-agent:}") String configuredUa,
            @Value("${app.fetch.accept-language:en-US,en;q=0.9}") String acceptLanguage,
            @Value("${app.fetch.timeout-ms:30000}") int timeoutMs,
            @Value("${app.fetch.max-attempts:3}") int maxAttempts,
            @Value("${app.fetch.backoff.multiplier-ms:1000}") long multiplierMs,
            @Value("${app.fetch.backoff.min-ms:1000}") long minMs,
            @Value("${app.fetch.backoff.max-ms:8000}") long maxMs
    ) {
        final long t0 = System.nanoTime();
        try {
            if (timeoutMs < 1) {
                log.warn("[AppConfig] app.fetch.timeout-ms={} inválido. Ajustando para {}.", timeoutMs, HttpFetch.DEFAULT_TIMEOUT_MS);
                timeoutMs = HttpFetch.DEFAULT_TIMEOUT_MS;
            }
            if (maxAttempts < 1) {
                log.warn("[AppConfig] app.fetch.max-attempts={} inválido. Ajustando para 1.", maxAttempts);
                maxAttempts = 1;
            }

            String userAgent = new UserAgentProvider().select(configuredUa);
            BackoffPolicy backoff = new BackoffPolicy(multiplierMs, minMs, maxMs);
            FetchPort bean = new HttpFetch(new JsoupHttpTransport(), userAgent, acceptLanguage,
                    timeoutMs, maxAttempts, backoff, Thread::sleep);

            long tookMs = (System.nanoTime() - t0) / 1_000_000;
            log.info("[AppConfig] FetchPort inicializado (timeoutMs={}, maxAttempts={}, backoff={}, ua='{}') tookMs={}ms",
                    timeoutMs, maxAttempts, backoff, userAgent, tookMs);
            return bean;
        } catch (RuntimeException e) {
            log.error("[AppConfig] Erro ao criar FetchPort: {}", e.getMessage(), e);
            throw e;
        }
    }

    /* ============================= PageRenderer ============================= */

    @Bean
    PageRenderer pageRenderer(
            @Value("${app.render.enabled:false}") boolean renderEnabled,
            @Value("${app.render.timeout-ms:15000}") long renderTimeoutMs,
            @Value("${app.fetch.user-agent:}") String configuredUa
    ) {
        if (!renderEnabled) {
            log.info("[AppConfig] Renderização desabilitada (app.render.enabled=false). Fontes renderizadas falharão isoladamente.");
            return new UnavailablePageRenderer("renderização desabilitada (app.render.enabled=false)");
        }
        if (renderTimeoutMs < 1) {
            log.warn("[AppConfig] app.render.timeout-ms={} inválido. Ajustando para 15000.", renderTimeoutMs);
            renderTimeoutMs = 15_000;
        }
        log.info("[AppConfig] PageRenderer Selenium habilitado (timeoutMs={})", renderTimeoutMs);
        return new SeleniumPageRenderer(Duration.ofMillis(renderTimeoutMs), configuredUa);
    }

    /* ============================= LinkDiscovery ============================= */

    @Bean
    LinkDiscovery linkDiscovery(
            FetchPort fetchPort,
            @Value("${app.discovery.follow-links:true}") boolean followLinks,
            @Value("${app.discovery.max-links:200}") int maxLinks
    ) {
        if (maxLinks < 1) {
            log.warn("[AppConfig] app.discovery.max-links={} inválido. Ajustando para 1.", maxLinks);
            maxLinks = 1;
        }
        log.info("[AppConfig] LinkDiscovery inicializado (followLinks={}, maxLinks={})", followLinks, maxLinks);
        return new LinkDiscovery(fetchPort, followLinks, maxLinks);
    }

    /* ============================= AdapterRegistry ============================= */

    @Bean
    AdapterRegistry adapterRegistry(
            FetchPort fetchPort,
            PageRenderer pageRenderer,
            LinkDiscovery linkDiscovery,
            Environment environment
    ) {
        final long t0 = System.nanoTime();
        try {
            SourceCatalog catalog = new SourceCatalog(fetchPort, pageRenderer, linkDiscovery, environment);
            AdapterRegistry bean = AdapterRegistry.of(catalog.defaultAdapters());
            long tookMs = (System.nanoTime() - t0) / 1_000_000;
            log.info("[AppConfig] AdapterRegistry inicializado (fontes={}) tookMs={}ms", bean.size(), tookMs);
            return bean;
        } catch (RuntimeException e) {
            log.error("[AppConfig] Erro ao montar AdapterRegistry: {}", e.getMessage(), e);
            throw e;
        }
    }

    /* ============================= RunCoursesUseCase ============================= */

    @Bean
    RunCoursesUseCase runCoursesUseCase(
            AdapterRegistry adapterRegistry,
            @Value("${app.run.concurrency:1}") int concurrency,
            @Value("${app.run.grace-period-ms:10000}") long gracePeriodMs
    ) {
        if (concurrency < 1) {
            log.warn("[AppConfig] app.run.concurrency={} inválido. Ajustando para 1.", concurrency);
            concurrency = 1;
        }
        if (gracePeriodMs < 0) {
            log.warn("[AppConfig] app.run.grace-period-ms={} inválido. Ajustando para 0.", gracePeriodMs);
            gracePeriodMs = 0;
        }
        log.info("[AppConfig] RunCoursesUseCase inicializado (concurrency={}, graceMs={})", concurrency, gracePeriodMs);
        return new RunControllerService(adapterRegistry, concurrency, gracePeriodMs);
    }

    /* ============================= CourseSink ============================= */

    @Bean
    CourseSink courseSink() {
        return new CsvCourseSink();
    }

    /* ============================= HarvestCommand ============================= */

    @Bean
    HarvestCommand harvestCommand(
            RunCoursesUseCase runCoursesUseCase,
            CourseSink courseSink,
            @Value("${app.output.default-path:data/courses.csv}") String defaultOut,
            @Value("${app.run.concurrency:1}") int concurrency,
            @Value("${app.run.grace-period-ms:10000}") long gracePeriodMs,
            @Value("${app.run.shutdown-write-ms:5000}") long shutdownWriteMs
    ) {
        // o hook de Ctrl-C espera o período de graça mais a gravação do CSV
        long shutdownWaitMs = Math.max(gracePeriodMs, 0) + Math.max(shutdownWriteMs, 0);
        return new HarvestCommand(runCoursesUseCase, courseSink, Path.of(defaultOut), concurrency, shutdownWaitMs);
    }
}
