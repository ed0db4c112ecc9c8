package tech.andrefsramos.elearning_harvester.adapters.outbound.render;

import org.junit.jupiter.api.Test;
import org.openqa.selenium.NoSuchSessionException;
import org.openqa.selenium.TimeoutException;
import tech.andrefsramos.elearning_harvester.core.domain.errors.AdapterException;
import tech.andrefsramos.elearning_harvester.core.domain.errors.ExtractionException;
import tech.andrefsramos.elearning_harvester.core.domain.errors.HarvestException;

import static org.junit.jupiter.api.Assertions.*;

public class SeleniumPageRendererTest {

    @Test
    void page_timeout_fails_the_whole_source() {
        HarvestException ex = SeleniumPageRenderer.translate("https://courses.test/portal/courses",
                new TimeoutException("page load timed out"));

        AdapterException adapter = assertInstanceOf(AdapterException.class, ex);
        assertEquals("courses.test", adapter.sourceKey());
        assertTrue(adapter.getMessage().contains("timeout"));
        assertInstanceOf(TimeoutException.class, adapter.getCause());
    }

    @Test
    void other_driver_errors_stay_page_level() {
        HarvestException ex = SeleniumPageRenderer.translate("https://courses.test/portal/courses",
                new NoSuchSessionException("session gone"));

        assertInstanceOf(ExtractionException.class, ex);
    }
}
