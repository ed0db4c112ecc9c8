package tech.andrefsramos.elearning_harvester.adapters.outbound.scrapers;

import org.jsoup.Jsoup;
import org.jsoup.nodes.Document;
import tech.andrefsramos.elearning_harvester.core.domain.RawResponse;
import tech.andrefsramos.elearning_harvester.core.ports.FetchPort;

import java.net.MalformedURLException;
import java.net.URL;
import java.util.Locale;

final class HtmlPages {

    private HtmlPages() {}

    /** GET + parse; a URL final da resposta vira base URI para resolver hrefs relativos. */
    static Document document(FetchPort fetch, String url) {
        RawResponse r = fetch.fetch(url);
        String base = r.url() == null || r.url().isBlank() ? url : r.url();
        return Jsoup.parse(r.body() == null ? "" : r.body(), base);
    }

    static String sanit(String s) {
        return s == null ? "" : s.trim();
    }

    static String join(String base, String path) {
        if (path == null || path.isBlank()) return base;
        if (path.startsWith("http")) return path;
        String b = base.endsWith("/") ? base.substring(0, base.length() - 1) : base;
        return path.startsWith("/") ? b + path : b + "/" + path;
    }

    static String stripFragment(String url) {
        int idx = url.indexOf('#');
        return idx >= 0 ? url.substring(0, idx) : url;
    }

    /** Compara protocolo, host e porta efetiva. URL tolera espaços e '|' que o absUrl do Jsoup não codifica. */
    static boolean sameOrigin(String a, String b) {
        try {
            URL x = new URL(a);
            URL y = new URL(b);
            if (x.getHost().isEmpty() || y.getHost().isEmpty()) {
                return false;
            }
            return x.getProtocol().equalsIgnoreCase(y.getProtocol())
                    && x.getHost().toLowerCase(Locale.ROOT).equals(y.getHost().toLowerCase(Locale.ROOT))
                    && effectivePort(x) == effectivePort(y);
        } catch (MalformedURLException e) {
            return false;
        }
    }

    private static int effectivePort(URL u) {
        return u.getPort() >= 0 ? u.getPort() : u.getDefaultPort();
    }
}
