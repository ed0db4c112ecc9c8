package tech.andrefsramos.elearning_harvester.adapters.outbound.scrapers;

import org.jsoup.nodes.Document;
import org.jsoup.nodes.Element;
import org.jsoup.select.Elements;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import tech.andrefsramos.elearning_harvester.core.domain.CourseRecord;
import tech.andrefsramos.elearning_harvester.core.domain.errors.AdapterException;
import tech.andrefsramos.elearning_harvester.core.domain.errors.FetchException;
import tech.andrefsramos.elearning_harvester.core.ports.FetchPort;
import tech.andrefsramos.elearning_harvester.core.ports.SourceAdapter;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.stream.Stream;

/*
 * Finalidade

 * Fontes com listagem estática conhecida: os anchors de curso são selecionados diretamente
 * por seletor CSS (ex.: Moodle ".coursebox a[href]"), sem heurística de palavras-chave e sem
 * visitar a página de detalhe.

 * Como funciona
 * - Percorre as páginas de listagem na ordem configurada; página que falha é ignorada,
 *   todas falhando -> AdapterException.
 * - Título = texto do anchor; vazio -> URL. Deduplicação por URL absoluta.
 */
public class SelectorListingAdapter implements SourceAdapter {
    private static final Logger log = LoggerFactory.getLogger(SelectorListingAdapter.class);

    private final SourceDescriptor source;
    private final FetchPort fetch;
    private final List<String> listingPaths;
    private final String anchorSelector;

    public SelectorListingAdapter(SourceDescriptor source, FetchPort fetch, List<String> listingPaths, String anchorSelector) {
        this.source = source;
        this.fetch = fetch;
        this.listingPaths = List.copyOf(listingPaths);
        this.anchorSelector = anchorSelector;
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
    public boolean isAllowed() {
        return source.allowed();
    }

    @Override
    public Stream<CourseRecord> iterCourses() {
        final Map<String, String> hrefToTitle = new LinkedHashMap<>();
        final List<String> failed = new ArrayList<>();

        for (String path : listingPaths) {
            final String url = HtmlPages.join(source.baseUrl(), path);
            final Document doc;
            try {
                doc = HtmlPages.document(fetch, url);
            } catch (FetchException e) {
                log.warn("[{}] listagem indisponível url={} causa={}", source.displayName(), url, e.getMessage());
                failed.add(url);
                continue;
            }

            final Elements anchors = doc.select(anchorSelector);
            int added = 0;
            for (Element a : anchors) {
                final String abs = HtmlPages.stripFragment(HtmlPages.sanit(a.absUrl("href")));
                if (abs.isBlank()) continue;
                final String text = HtmlPages.sanit(a.text());
                if (hrefToTitle.putIfAbsent(abs, text.isBlank() ? abs : text) == null) added++;
            }
            log.info("[{}] listagem url={} anchorsTot={} added={} totalSoFar={}",
                    source.displayName(), url, anchors.size(), added, hrefToTitle.size());
        }

        if (failed.size() == listingPaths.size()) {
            throw new AdapterException(source.key(), "nenhuma página de listagem acessível: " + failed);
        }

        final List<CourseRecord> out = new ArrayList<>(hrefToTitle.size());
        hrefToTitle.forEach((href, title) -> out.add(CourseRecord.builder()
                .id(href)
                .title(title)
                .url(href)
                .provider(source.displayName())
                .build()));
        return out.stream();
    }
}
