package tech.andrefsramos.elearning_harvester.adapters.outbound.http;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

public class UserAgentProviderTest {

    @Test
    void configured_value_wins() {
        UserAgentProvider p = new UserAgentProvider(() -> "Pool/1.0");

        assertEquals("Custom/2.0", p.select("  Custom/2.0 "));
    }

    @Test
    void blank_configuration_uses_the_pool() {
        String ua = new UserAgentProvider().select("");

        assertTrue(UserAgentProvider.POOL.contains(ua), ua);
    }

    @Test
    void failing_rotation_falls_back_to_default() {
        UserAgentProvider p = new UserAgentProvider(() -> { throw new IllegalStateException("boom"); });

        assertEquals(UserAgentProvider.DEFAULT_UA, p.select(null));
    }

    @Test
    void blank_rotation_result_falls_back_to_default() {
        assertEquals(UserAgentProvider.DEFAULT_UA, new UserAgentProvider(() -> " ").select(null));
    }
}
