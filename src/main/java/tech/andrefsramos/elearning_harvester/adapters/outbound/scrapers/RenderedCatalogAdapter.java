package tech.andrefsramos.elearning_harvester.adapters.outbound.scrapers;

import org.jsoup.Jsoup;
import org.jsoup.nodes.Document;
import org.jsoup.nodes.Element;
import org.jsoup.select.Elements;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import tech.andrefsramos.elearning_harvester.core.domain.CourseRecord;
import tech.andrefsramos.elearning_harvester.core.domain.errors.AdapterException;
import tech.andrefsramos.elearning_harvester.core.domain.errors.ConfigurationException;
import tech.andrefsramos.elearning_harvester.core.domain.errors.ExtractionException;
import tech.andrefsramos.elearning_harvester.core.ports.PageRenderer;
import tech.andrefsramos.elearning_harvester.core.ports.SourceAdapter;

import java.time.Duration;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Set;
import java.util.stream.Stream;

/*
 * Finalidade

 * Catálogos montados via JavaScript (SPA): a página é renderizada pelo {@link PageRenderer}
 * (navegador headless) e os cards de curso são extraídos do HTML resultante.

 * Como funciona
 * - render(url, waitCss, settle); renderizador indisponível -> ConfigurationException (sobe como está);
 *   qualquer outra falha de renderização -> AdapterException.
 * - Para cada card: título pelo seletor da fonte; URL do primeiro a[href] do card, ou
 *   "catálogo#n" quando o card não tem link. Card sem título é descartado (ExtractionException, DEBUG).
 */
public class RenderedCatalogAdapter implements SourceAdapter {
    private static final Logger log = LoggerFactory.getLogger(RenderedCatalogAdapter.class);

    private final SourceDescriptor source;
    private final PageRenderer renderer;
    private final String catalogPath;
    private final String waitCss;
    private final Duration settle;
    private final String cardSelector;
    private final String titleSelector;

    public RenderedCatalogAdapter(SourceDescriptor source, PageRenderer renderer, String catalogPath, String waitCss,
                                  Duration settle, String cardSelector, String titleSelector) {
        this.source = source;
        this.renderer = renderer;
        this.catalogPath = catalogPath;
        this.waitCss = waitCss;
        this.settle = settle;
        this.cardSelector = cardSelector;
        this.titleSelector = titleSelector;
    }

    @Override
    public String key() {
        return source.key();
    }

    @Override
    public String displayName() {
        return source.displayName();
    }

    @Override
    public String baseUrl() {
        return source.baseUrl();
    }

    @Override
    public boolean requiresRendering() {
        return true;
    }

    @Override
    public boolean isAllowed() {
        return source.allowed();
    }

    @Override
    public Stream<CourseRecord> iterCourses() {
        final String url = HtmlPages.join(source.baseUrl(), catalogPath);
        final long t0 = System.nanoTime();

        final String html;
        try {
            html = renderer.render(url, waitCss, settle);
        } catch (ConfigurationException e) {
            throw e;
        } catch (RuntimeException e) {
            throw new AdapterException(source.key(), "falha ao renderizar " + url + ": " + e.getMessage(), e);
        }

        final Document doc = Jsoup.parse(html == null ? "" : html, url);
        final Elements cards = doc.select(cardSelector);
        final List<CourseRecord> out = new ArrayList<>(cards.size());
        final Set<String> ids = new HashSet<>();

        int index = 0;
        for (Element card : cards) {
            index++;
            try {
                out.add(toRecord(card, url, index, ids));
            } catch (ExtractionException e) {
                log.debug("[{}] card ignorado index={} causa={}", source.displayName(), index, e.getMessage());
            }
        }

        final long tookMs = (System.nanoTime() - t0) / 1_000_000;
        if (out.isEmpty()) {
            log.warn("[{}] nenhum curso extraído. cards={} url={} tookMs={}ms", source.displayName(), cards.size(), url, tookMs);
        } else {
            log.info("[{}] total extraído={} cards={} tookMs={}ms", source.displayName(), out.size(), cards.size(), tookMs);
        }
        return out.stream();
    }

    private CourseRecord toRecord(Element card, String catalogUrl, int index, Set<String> ids) {
        final Element titleEl = card.selectFirst(titleSelector);
        final String title = titleEl == null ? "" : HtmlPages.sanit(titleEl.text());
        if (title.isBlank()) {
            throw new ExtractionException(catalogUrl, "card sem '" + titleSelector + "'");
        }

        final Element a = card.is("a[href]") ? card : card.selectFirst("a[href]");
        final String href = a == null ? "" : HtmlPages.stripFragment(HtmlPages.sanit(a.absUrl("href")));
        final String courseUrl = href.isBlank() ? catalogUrl : href;

        String id = href.isBlank() ? catalogUrl + "#" + index : href;
        if (!ids.add(id)) {
            id = id + "#" + index;
            ids.add(id);
        }

        return CourseRecord.builder()
                .id(id)
                .title(title)
                .url(courseUrl)
                .provider(source.displayName())
                .build();
    }
}
