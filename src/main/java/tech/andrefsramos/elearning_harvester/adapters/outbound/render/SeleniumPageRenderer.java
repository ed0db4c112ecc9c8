package tech.andrefsramos.elearning_harvester.adapters.outbound.render;

import org.openqa.selenium.By;
import org.openqa.selenium.TimeoutException;
import org.openqa.selenium.WebDriver;
import org.openqa.selenium.WebDriverException;
import org.openqa.selenium.chrome.ChromeDriver;
import org.openqa.selenium.chrome.ChromeOptions;
import org.openqa.selenium.support.ui.ExpectedConditions;
import org.openqa.selenium.support.ui.WebDriverWait;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import tech.andrefsramos.elearning_harvester.core.domain.errors.AdapterException;
import tech.andrefsramos.elearning_harvester.core.domain.errors.ExtractionException;
import tech.andrefsramos.elearning_harvester.core.domain.errors.HarvestException;
import tech.andrefsramos.elearning_harvester.core.domain.errors.RenderUnavailableException;
import tech.andrefsramos.elearning_harvester.core.ports.PageRenderer;

import java.net.URI;
import java.time.Duration;

/*
 * Finalidade

 * Renderiza páginas dependentes de JavaScript num Chrome headless (Selenium WebDriver) e
 * devolve o HTML final.

 * Como funciona
 * - Um navegador por chamada, sempre encerrado no finally (driver.quit()).
 * - Espera fixa (settle) após o carregamento e, se informado, espera explícita pelo seletor CSS.
 * - Falha ao iniciar o navegador/driver -> RenderUnavailableException (erro de configuração).
 * - Timeout de carregamento ou da espera pelo seletor -> AdapterException (fonte inteira falha).
 * - Demais erros de navegação -> ExtractionException da página.
 */
public class SeleniumPageRenderer implements PageRenderer {

    private static final Logger log = LoggerFactory.getLogger(SeleniumPageRenderer.class);

    private final Duration pageTimeout;
    private final String userAgent;

    public SeleniumPageRenderer(Duration pageTimeout, String userAgent) {
        this.pageTimeout = pageTimeout;
        this.userAgent = userAgent;
    }

    @Override
    public String render(String url, String waitCss, Duration settle) {
        final long start = System.nanoTime();
        final WebDriver driver = startDriver();
        try {
            driver.manage().timeouts().pageLoadTimeout(pageTimeout);
            driver.get(url);
            if (settle != null && !settle.isNegative() && !settle.isZero()) {
                Thread.sleep(settle.toMillis());
            }
            if (waitCss != null && !waitCss.isBlank()) {
                new WebDriverWait(driver, pageTimeout)
                        .until(ExpectedConditions.presenceOfElementLocated(By.cssSelector(waitCss)));
            }
            String html = driver.getPageSource();
            long elapsedMs = (System.nanoTime() - start) / 1_000_000;
            log.info("SeleniumPageRenderer: renderizado url={} bytes={} elapsedMs={}ms",
                    url, html == null ? 0 : html.length(), elapsedMs);
            return html;
        } catch (InterruptedException ie) {
            Thread.currentThread().interrupt();
            throw new ExtractionException(url, "renderização interrompida", ie);
        } catch (WebDriverException e) {
            long elapsedMs = (System.nanoTime() - start) / 1_000_000;
            log.warn("SeleniumPageRenderer: falha url={} waitCss={} elapsedMs={}ms msg={}", url, waitCss, elapsedMs, e.getMessage());
            throw translate(url, e);
        } finally {
            try {
                driver.quit();
            } catch (WebDriverException e) {
                log.debug("SeleniumPageRenderer: erro ao encerrar o driver url={} msg={}", url, e.getMessage());
            }
        }
    }

    static HarvestException translate(String url, WebDriverException e) {
        if (e instanceof TimeoutException) {
            return new AdapterException(hostOf(url), "timeout ao renderizar " + url, e);
        }
        return new ExtractionException(url, "falha na renderização", e);
    }

    private static String hostOf(String url) {
        try {
            String host = URI.create(url).getHost();
            return host != null ? host : url;
        } catch (IllegalArgumentException e) {
            return url;
        }
    }

    private WebDriver startDriver() {
        ChromeOptions opts = new ChromeOptions();
        opts.addArguments("--headless=new", "--no-sandbox", "--disable-dev-shm-usage");
        if (userAgent != null && !userAgent.isBlank()) {
            opts.addArguments("--user-agent=" + userAgent);
        }
        try {
            return new ChromeDriver(opts);
        } catch (WebDriverException | IllegalStateException e) {
            throw new RenderUnavailableException("Chrome/WebDriver indisponível: " + e.getMessage(), e);
        }
    }
}
