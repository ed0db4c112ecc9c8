package tech.andrefsramos.elearning_harvester.adapters.outbound.scrapers;

import org.jsoup.nodes.Document;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import tech.andrefsramos.elearning_harvester.core.domain.CourseRecord;
import tech.andrefsramos.elearning_harvester.core.domain.errors.AdapterException;
import tech.andrefsramos.elearning_harvester.core.domain.errors.FetchException;
import tech.andrefsramos.elearning_harvester.core.ports.SourceAdapter;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.regex.Pattern;
import java.util.stream.Stream;

/*
 * Finalidade

 * Varre várias páginas de catálogo da mesma fonte (ex.: base e /courses), junta os links de
 * curso sem repetição e extrai o título do detalhe com um seletor próprio da fonte.

 * Como funciona
 * - Cada página de catálogo que falha é apenas registrada em log; se todas falharem -> AdapterException.
 * - Deduplicação por URL absoluta entre as páginas, preservando a ordem de descoberta.
 */
public class CatalogCrawlAdapter implements SourceAdapter {
    private static final Logger log = LoggerFactory.getLogger(CatalogCrawlAdapter.class);

    private final SourceDescriptor source;
    private final LinkDiscovery discovery;
    private final List<String> catalogPaths;
    private final Pattern keywords;
    private final String titleSelector;

    public CatalogCrawlAdapter(SourceDescriptor source, LinkDiscovery discovery, List<String> catalogPaths,
                               String keywordRegex, String titleSelector) {
        this.source = source;
        this.discovery = discovery;
        this.catalogPaths = List.copyOf(catalogPaths);
        this.keywords = Pattern.compile(keywordRegex, Pattern.CASE_INSENSITIVE);
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
    public boolean isAllowed() {
        return source.allowed();
    }

    @Override
    public Stream<CourseRecord> iterCourses() {
        final Map<String, DiscoveredLink> seen = new LinkedHashMap<>();
        final List<String> failed = new ArrayList<>();

        for (String path : catalogPaths) {
            final String url = HtmlPages.join(source.baseUrl(), path);
            final Document doc;
            try {
                doc = discovery.page(url);
            } catch (FetchException e) {
                log.warn("[{}] catálogo indisponível url={} causa={}", source.displayName(), url, e.getMessage());
                failed.add(url);
                continue;
            }
            int added = 0;
            for (DiscoveredLink link : discovery.discover(doc, source.baseUrl(), keywords)) {
                if (seen.putIfAbsent(link.url(), link) == null) added++;
            }
            log.info("[{}] catálogo url={} added={} totalSoFar={}", source.displayName(), url, added, seen.size());
        }

        if (failed.size() == catalogPaths.size()) {
            throw new AdapterException(source.key(), "nenhuma página de catálogo acessível: " + failed);
        }

        return seen.values().stream()
                .map(link -> discovery.describe(link, source.displayName(), titleSelector));
    }
}
