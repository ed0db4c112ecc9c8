package tech.andrefsramos.elearning_harvester.adapters.outbound.scrapers;

import org.junit.jupiter.api.Test;
import tech.andrefsramos.elearning_harvester.core.domain.CourseRecord;
import tech.andrefsramos.elearning_harvester.core.domain.errors.AdapterException;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

public class CatalogCrawlAdapterTest {

    private static final String BASE = "https://learn.test";
    private static final String TITLES = "h1, h2.page-title, .course-title";

    private static CatalogCrawlAdapter adapter(FakeFetch fetch) {
        return new CatalogCrawlAdapter(new SourceDescriptor("learn", "Learn Test", BASE, true),
                new LinkDiscovery(fetch, true, 200), List.of("", "/courses"), "/course/|/courses/", TITLES);
    }

    @Test
    void merges_catalog_pages_without_repeating_links() {
        FakeFetch fetch = new FakeFetch()
                .page(BASE, "<a href=\"/course/a\">A anchor</a><a href=\"/blog/news\">News</a>")
                .page(BASE + "/courses", "<a href=\"/course/a\">A again</a><a href=\"/course/b\">B</a>")
                .page(BASE + "/course/a", "<html><body><h2 class=\"page-title\">A title</h2></body></html>");

        List<CourseRecord> records = adapter(fetch).iterCourses().toList();

        assertEquals(List.of(BASE + "/course/a", BASE + "/course/b"), records.stream().map(CourseRecord::url).toList());
        assertEquals("A title", records.get(0).title());
        assertEquals("B", records.get(1).title());
        assertEquals("Learn Test", records.get(1).provider());
    }

    @Test
    void tolerates_one_missing_catalog_page() {
        FakeFetch fetch = new FakeFetch()
                .page(BASE + "/courses", "<a href=\"/course/c\">C</a>");

        List<CourseRecord> records = adapter(fetch).iterCourses().toList();

        assertEquals(1, records.size());
        assertEquals("C", records.get(0).title());
    }

    @Test
    void all_catalog_pages_missing_is_an_adapter_failure() {
        assertThrows(AdapterException.class, () -> adapter(new FakeFetch()).iterCourses());
    }
}
