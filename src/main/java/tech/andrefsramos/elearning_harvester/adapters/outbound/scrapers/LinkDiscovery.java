package tech.andrefsramos.elearning_harvester.adapters.outbound.scrapers;

import org.jsoup.nodes.Document;
import org.jsoup.nodes.Element;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import tech.andrefsramos.elearning_harvester.core.domain.CourseRecord;
import tech.andrefsramos.elearning_harvester.core.domain.errors.ExtractionException;
import tech.andrefsramos.elearning_harvester.core.ports.FetchPort;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.regex.Pattern;

/*
 * Finalidade

 * Heurística de descoberta de cursos para fontes com HTML desconhecido.

 * Como funciona
 * - Coleta todos os a[href] da página e resolve contra a base URI do documento.
 * - Mantém apenas links da mesma origem (scheme + host + porta) da URL base da fonte e que
 *   casam com o padrão de palavras-chave da fonte (case-insensitive, aplicado à URL).
 * - Remove fragmentos (#...) e deduplica preservando a ordem do documento; aplica maxLinks.
 * - Para cada link sobrevivente (followLinks=true) busca a página de detalhe e extrai o título
 *   do primeiro h1, h2 ou title; senão usa o texto do anchor; senão a própria URL.
 * - Falha em uma página de detalhe nunca derruba as demais: o item cai no fallback.
 */
public class LinkDiscovery {
    private static final Logger log = LoggerFactory.getLogger(LinkDiscovery.class);

    static final String DEFAULT_TITLE_SELECTOR = "h1, h2, title";

    private final FetchPort fetch;
    private final boolean followLinks;
    private final int maxLinks;

    public LinkDiscovery(FetchPort fetch, boolean followLinks, int maxLinks) {
        this.fetch = Objects.requireNonNull(fetch, "fetch is required");
        this.followLinks = followLinks;
        this.maxLinks = Math.max(1, maxLinks);
    }

    public Document page(String url) {
        return HtmlPages.document(fetch, url);
    }

    public List<DiscoveredLink> discover(Document page, String baseUrl, Pattern keywords) {
        final Map<String, String> seen = new LinkedHashMap<>();
        int total = 0;
        for (Element a : page.select("a[href]")) {
            total++;
            final String abs = HtmlPages.stripFragment(HtmlPages.sanit(a.absUrl("href")));
            if (abs.isBlank()) continue;
            if (!HtmlPages.sameOrigin(abs, baseUrl)) continue;
            if (keywords != null && !keywords.matcher(abs).find()) continue;

            seen.putIfAbsent(abs, HtmlPages.sanit(a.text()));
            if (seen.size() >= maxLinks) {
                log.warn("LinkDiscovery: atingiu maxLinks={} base={} — interrompendo.", maxLinks, baseUrl);
                break;
            }
        }

        final List<DiscoveredLink> out = new ArrayList<>(seen.size());
        seen.forEach((url, text) -> out.add(new DiscoveredLink(url, text)));
        log.debug("LinkDiscovery: base={} anchorsTot={} candidatos={}", baseUrl, total, out.size());
        return out;
    }

    public CourseRecord describe(DiscoveredLink link, String provider) {
        return describe(link, provider, DEFAULT_TITLE_SELECTOR);
    }

    public CourseRecord describe(DiscoveredLink link, String provider, String titleSelector) {
        final CourseRecord.CourseRecordBuilder b = CourseRecord.builder()
                .id(link.url())
                .url(link.url())
                .provider(provider);

        String title = "";
        if (followLinks) {
            try {
                Document detail = page(link.url());
                DetailFields.enrich(b, detail, link.url());
                title = headingOf(detail, titleSelector == null ? DEFAULT_TITLE_SELECTOR : titleSelector);
            } catch (RuntimeException e) {
                log.debug("LinkDiscovery: detalhe indisponível url={} causa={} — usando fallback.", link.url(), e.getMessage());
            }
        }
        if (title.isBlank()) title = HtmlPages.sanit(link.anchorText());
        if (title.isBlank()) title = link.url();

        return b.title(title).build();
    }

    static String headingOf(Document doc, String selector) {
        for (String css : selector.split(",")) {
            Element el = doc.selectFirst(css.trim());
            if (el != null) {
                String text = HtmlPages.sanit(el.text());
                if (!text.isBlank()) return text;
            }
        }
        throw new ExtractionException(doc.location(), "nenhum título encontrado com '" + selector + "'");
    }

    public boolean followLinks() {
        return followLinks;
    }
}
