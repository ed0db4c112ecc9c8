package tech.andrefsramos.elearning_harvester.adapters.outbound.scrapers;

import org.junit.jupiter.api.Test;
import tech.andrefsramos.elearning_harvester.core.domain.CourseRecord;
import tech.andrefsramos.elearning_harvester.core.domain.errors.AdapterException;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

public class SelectorListingAdapterTest {

    private static final String MOODLE = ".coursebox a[href], .course-title a[href], a.coursename";

    @Test
    void moodle_listing_falls_back_to_the_base_page() {
        String base = "https://lms.test";
        FakeFetch fetch = new FakeFetch().page(base, """
                <div class="coursebox"><a href="/course/view.php?id=1">Introdução à TI</a></div>
                <div class="coursebox"><a href="/course/view.php?id=1#top">Introdução à TI (dup)</a></div>
                <a class="coursename" href="/course/view.php?id=2"></a>
                <a href="/login/index.php">Entrar</a>
                """);
        SelectorListingAdapter adapter = new SelectorListingAdapter(new SourceDescriptor("lms", "LMS Test", base, true),
                fetch, List.of("/course/index.php", ""), MOODLE);

        List<CourseRecord> records = adapter.iterCourses().toList();

        assertEquals(List.of(base + "/course/index.php", base), fetch.calls);
        assertEquals(2, records.size());
        assertEquals("Introdução à TI", records.get(0).title());
        assertEquals(base + "/course/view.php?id=1", records.get(0).id());
        assertEquals(base + "/course/view.php?id=2", records.get(1).title(), "empty anchor text -> url");
        assertTrue(records.stream().allMatch(r -> "LMS Test".equals(r.provider())));
    }

    @Test
    void popular_courses_block() {
        String base = "https://eopcw.test";
        FakeFetch fetch = new FakeFetch().page(base + "/", """
                <div id="popular-courses">
                  <a href="/courses/hr">HR Management</a>
                  <a href="/courses/ppe">Procurement</a>
                </div>
                <div id="footer"><a href="/courses/other">Other</a></div>
                """);
        SelectorListingAdapter adapter = new SelectorListingAdapter(new SourceDescriptor("eopcw", "EOPCW", base, true),
                fetch, List.of("/"), "div#popular-courses a");

        List<CourseRecord> records = adapter.iterCourses().toList();

        assertEquals(List.of("HR Management", "Procurement"), records.stream().map(CourseRecord::title).toList());
    }

    @Test
    void every_listing_page_failing_is_an_adapter_failure() {
        SelectorListingAdapter adapter = new SelectorListingAdapter(new SourceDescriptor("lms", "LMS", "https://lms.test", true),
                new FakeFetch(), List.of("/course/index.php", ""), MOODLE);

        assertThrows(AdapterException.class, adapter::iterCourses);
    }
}
