package tech.andrefsramos.elearning_harvester.adapters.outbound.scrapers;

import org.jsoup.nodes.Document;
import org.jsoup.nodes.Element;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import tech.andrefsramos.elearning_harvester.core.domain.CourseRecord;

import java.util.Locale;
import java.util.Optional;
import java.util.function.Supplier;

/*
 * Finalidade

 * Extração dos campos opcionais de uma página de detalhe de curso. Cada campo é uma busca
 * independente que devolve Optional: falha ou ausência vira "não extraído" (log DEBUG)
 * e nunca interrompe o registro.
 */
final class DetailFields {
    private static final Logger log = LoggerFactory.getLogger(DetailFields.class);

    private DetailFields() {}

    static void enrich(CourseRecord.CourseRecordBuilder b, Document d, String url) {
        field("language", url, () -> attr(d, "html[lang]", "lang")).ifPresent(b::language);
        field("price", url, () -> firstOf(d, "[itemprop=price]", ".course-price", ".price")).ifPresent(p -> {
            b.price(p);
            isPaid(p).ifPresent(b::isPaid);
        });
        field("level", url, () -> firstOf(d, "[itemprop=educationalLevel]", ".course-level")).ifPresent(b::level);
        field("contentDuration", url, () -> firstOf(d, "[itemprop=timeRequired]", ".course-duration")).ifPresent(b::contentDuration);
        field("publishedTimestamp", url, () -> firstOf(d, "meta[property=article:published_time]", "[itemprop=datePublished]"))
                .ifPresent(b::publishedTimestamp);
        field("subject", url, () -> firstOf(d, "meta[property=article:section]", ".course-category")).ifPresent(b::subject);
        field("numLectures", url, () -> firstOf(d, ".lessons-count", ".lecture-count")).flatMap(DetailFields::digits).ifPresent(b::numLectures);
        field("numReviews", url, () -> firstOf(d, "[itemprop=reviewCount]", ".reviews-count")).flatMap(DetailFields::digits).ifPresent(b::numReviews);
        field("numSubscribers", url, () -> firstOf(d, ".students-count", ".enrolled-count")).flatMap(DetailFields::digits).ifPresent(b::numSubscribers);
    }

    static Optional<String> field(String name, String url, Supplier<String> extractor) {
        try {
            return Optional.ofNullable(extractor.get())
                    .map(String::trim)
                    .filter(s -> !s.isEmpty());
        } catch (RuntimeException e) {
            log.debug("DetailFields: campo={} não extraído url={} causa={}", name, url, e.toString());
            return Optional.empty();
        }
    }

    static Optional<Integer> digits(String s) {
        String only = s.replaceAll("\\D+", "");
        if (only.isEmpty() || only.length() > 9) return Optional.empty();
        return Optional.of(Integer.parseInt(only));
    }

    static Optional<Boolean> isPaid(String price) {
        String p = price.toLowerCase(Locale.ROOT);
        if (p.contains("free") || p.contains("gratis") || p.contains("grátis")) return Optional.of(false);
        String num = p.replaceAll("[^0-9.]", "");
        if (num.isEmpty() || num.equals(".")) return Optional.empty();
        try {
            return Optional.of(Double.parseDouble(num) > 0);
        } catch (NumberFormatException e) {
            return Optional.empty();
        }
    }

    private static String attr(Document d, String css, String attr) {
        Element el = d.selectFirst(css);
        return el == null ? null : el.attr(attr);
    }

    private static String firstOf(Document d, String... selectors) {
        for (String css : selectors) {
            Element el = d.selectFirst(css);
            if (el == null) continue;
            String v = el.hasAttr("content") ? el.attr("content") : el.text();
            if (v != null && !v.isBlank()) return v;
        }
        return null;
    }
}
