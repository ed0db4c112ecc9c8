package tech.andrefsramos.elearning_harvester.adapters.outbound.scrapers;

import org.jsoup.nodes.Document;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import tech.andrefsramos.elearning_harvester.core.domain.CourseRecord;
import tech.andrefsramos.elearning_harvester.core.domain.errors.AdapterException;
import tech.andrefsramos.elearning_harvester.core.domain.errors.FetchException;
import tech.andrefsramos.elearning_harvester.core.ports.SourceAdapter;

import java.util.List;
import java.util.regex.Pattern;
import java.util.stream.Stream;

/*
 * Finalidade

 * Adapter genérico para fontes sem catálogo estruturado conhecido: varre a homepage com a
 * heurística de {@link LinkDiscovery} usando o padrão de palavras-chave da fonte.
 * Campos fixos por fonte (subject, language) são aplicados a todos os registros.

 * Como funciona
 * - Homepage inacessível após os retries -> AdapterException.
 * - Links candidatos viram registros de forma preguiçosa (a página de detalhe só é buscada
 *   quando o stream é consumido).
 */
public class KeywordLinkAdapter implements SourceAdapter {
    private static final Logger log = LoggerFactory.getLogger(KeywordLinkAdapter.class);

    private final SourceDescriptor source;
    private final LinkDiscovery discovery;
    private final Pattern keywords;
    private final String subject;
    private final String language;

    public KeywordLinkAdapter(SourceDescriptor source, LinkDiscovery discovery, String keywordRegex) {
        this(source, discovery, Pattern.compile(keywordRegex, Pattern.CASE_INSENSITIVE), null, null);
    }

    private KeywordLinkAdapter(SourceDescriptor source, LinkDiscovery discovery, Pattern keywords,
                               String subject, String language) {
        this.source = source;
        this.discovery = discovery;
        this.keywords = keywords;
        this.subject = subject;
        this.language = language;
    }

    public KeywordLinkAdapter withSubject(String subject) {
        return new KeywordLinkAdapter(source, discovery, keywords, subject, language);
    }

    public KeywordLinkAdapter withLanguage(String language) {
        return new KeywordLinkAdapter(source, discovery, keywords, subject, language);
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
        final Document home;
        try {
            home = discovery.page(source.baseUrl());
        } catch (FetchException e) {
            throw new AdapterException(source.key(), "homepage inacessível: " + e.getMessage(), e);
        }

        final List<DiscoveredLink> links = discovery.discover(home, source.baseUrl(), keywords);
        log.info("[{}] homepage={} candidatos={} followLinks={}",
                source.displayName(), source.baseUrl(), links.size(), discovery.followLinks());

        return links.stream()
                .map(link -> discovery.describe(link, source.displayName()))
                .map(this::applyFixedFields);
    }

    private CourseRecord applyFixedFields(CourseRecord r) {
        if (subject == null && language == null) return r;
        CourseRecord.CourseRecordBuilder b = r.toBuilder();
        if (subject != null) b.subject(subject);
        if (language != null) b.language(language);
        return b.build();
    }
}
