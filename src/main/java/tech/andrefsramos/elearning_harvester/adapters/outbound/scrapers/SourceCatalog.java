package tech.andrefsramos.elearning_harvester.adapters.outbound.scrapers;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.core.env.PropertyResolver;
import tech.andrefsramos.elearning_harvester.core.ports.FetchPort;
import tech.andrefsramos.elearning_harvester.core.ports.PageRenderer;
import tech.andrefsramos.elearning_harvester.core.ports.SourceAdapter;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;

/*
 * Finalidade

 * Lista explícita (e ordenada) das fontes suportadas. É a única chamada de registro: o
 * AdapterRegistry é montado a partir de {@link #defaultAdapters()} durante a inicialização.

 * Configuração por fonte (application.yml / env)
 * - app.sources.<key>.base-url: substitui a URL base padrão (necessário para domínios *.example).
 * - app.sources.<key>.enabled: false desliga a fonte (isAllowed=false -> SKIPPED).
 */
public class SourceCatalog {
    private static final Logger log = LoggerFactory.getLogger(SourceCatalog.class);

    private static final Duration RENDER_SETTLE = Duration.ofSeconds(3);
    private static final String GENERIC_LMS = "course|program|catalog|category";

    private final FetchPort fetch;
    private final PageRenderer renderer;
    private final LinkDiscovery discovery;
    private final PropertyResolver props;

    public SourceCatalog(FetchPort fetch, PageRenderer renderer, LinkDiscovery discovery, PropertyResolver props) {
        this.fetch = fetch;
        this.renderer = renderer;
        this.discovery = discovery;
        this.props = props;
    }

    public List<SourceAdapter> defaultAdapters() {
        final List<SourceAdapter> out = new ArrayList<>();

        out.add(keyword("learninggov", "Learning.gov.et", "https://learning.gov.et",
                "course|training|program|module"));
        out.add(new CatalogCrawlAdapter(
                source("learnethiopia", "LearnEthiopia.com", "https://learnethiopia.com"),
                discovery, List.of("", "/courses"), "/course/|/courses/|/program/",
                "h1, h2.page-title, .course-title"));
        out.add(keyword("eduhubplc", "EDUHUB Technology Solutions", "https://eduhubplc.com",
                "course|training|solution|product"));
        out.add(keyword("alx", "ALX Africa", "https://www.alxafrica.com",
                "program|course|software|data|cloud|ai"));
        out.add(keyword("smartethio", "SmartEthio", "https://smartethio.com",
                "grade|subject|course|lesson|exam").withSubject("K12"));
        out.add(keyword("afriwork", "Afriwork", "https://afriwork.com",
                "learn|academy|blog|training|skills"));
        out.add(keyword("kubaya", "Kubaya Learning", "https://kubayalearning.com",
                "course|lesson|learn|levels|amharic").withLanguage("Amharic"));
        out.add(keyword("staffordglobal", "Stafford Global", "https://www.staffordglobal.org",
                "program|course|mba|msc|pgce|degree"));
        out.add(new SelectorListingAdapter(
                source("elearneth", "eLearn Ethiopia", "https://elearnethiopia.example"),
                fetch, List.of("/course/index.php", ""), ".coursebox a[href], .course-title a[href], a.coursename"));
        out.add(keyword("aau", "AAU e-Learning", "https://elearning.aau.edu.et", GENERIC_LMS));
        out.add(keyword("aau_elearnafrica", "AAU-eLearnAfrica LMS", "https://elearnafrica.example", GENERIC_LMS));
        out.add(keyword("stmarys", "St. Mary's University Distance Education", "https://smuc.edu.et",
                "distance|program|course|degree"));
        out.add(keyword("ili", "International Leadership Institute", "https://ili.edu.et",
                "program|course|diploma|degree|certificate"));
        out.add(keyword("infonet", "Infonet College", "https://infonetcollege.example",
                "short-course|training|program|course"));
        out.add(keyword("microlink", "Microlink IT College", "https://microlinkcolleges.net",
                "cisco|ict|program|course|training"));
        out.add(keyword("ennlite", "Ennlite Academy", "https://ennlite.example",
                "course|training|graphic|marketing|web|app"));
        out.add(keyword("gxcamp", "GxCamp", "https://gxcamp.example",
                "course|ict|english|web|amharic"));
        out.add(pending("learnup", "LearnUp Ethiopia", "https://learnup.example",
                "páginas de programa ainda não mapeadas"));
        out.add(pending("5mec", "5 Million Ethiopian Coders", "https://5millioncoders.example",
                "página de iniciativa que aponta para parceiros"));
        out.add(pending("hagerly", "Hagerly", "https://hagerly.example", "lista de espera, pré-lançamento"));
        out.add(pending("haleta", "Haleta App", "https://haleta.example", "app mobile"));
        out.add(pending("zementechnologies", "Zemen Technologies", "https://zemen-technology.example",
                "site institucional"));
        out.add(new RenderedCatalogAdapter(
                source("ethernet", "Ethernet LMS", "https://courses.ethernet.edu.et"),
                renderer, "/portal/courses", "#root", RENDER_SETTLE, "div.course-box", "h4"));
        out.add(new RenderedCatalogAdapter(
                source("learninggov_catalog", "Learning.gov.et All Courses", "https://learning.gov.et"),
                renderer, "/all-courses/", ".ld-course-list-items", RENDER_SETTLE, ".ld-course-list-items", "h3"));
        out.add(new SelectorListingAdapter(
                source("eopcw", "EOPCW", "https://eopcw.com"),
                fetch, List.of("/"), "div#popular-courses a"));

        long allowed = out.stream().filter(SourceAdapter::isAllowed).count();
        log.info("[SourceCatalog] {} fontes montadas ({} permitidas, {} pendentes de configuração/desligadas)",
                out.size(), allowed, out.size() - allowed);
        return out;
    }

    SourceDescriptor source(String key, String displayName, String defaultBaseUrl) {
        final String prefix = "app.sources." + key + ".";
        String baseUrl = props.getProperty(prefix + "base-url", defaultBaseUrl).trim();
        if (baseUrl.isBlank()) {
            baseUrl = defaultBaseUrl;
        }
        if (baseUrl.endsWith("/")) {
            baseUrl = baseUrl.substring(0, baseUrl.length() - 1);
        }
        final boolean enabled = props.getProperty(prefix + "enabled", Boolean.class, Boolean.TRUE);
        return new SourceDescriptor(key, displayName, baseUrl, enabled);
    }

    private KeywordLinkAdapter keyword(String key, String displayName, String baseUrl, String keywords) {
        return new KeywordLinkAdapter(source(key, displayName, baseUrl), discovery, keywords);
    }

    private PendingSourceAdapter pending(String key, String displayName, String baseUrl, String reason) {
        return new PendingSourceAdapter(source(key, displayName, baseUrl), reason);
    }
}
