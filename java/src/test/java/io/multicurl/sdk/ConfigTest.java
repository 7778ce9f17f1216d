package io.multicurl.sdk;

import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class ConfigTest {

    @Test
    void appliesDefaultsForOptionalFields() {
        Config config = Config.builder()
            .baseUrl("https://lms.example.com/")
            .accessToken("token")
            .build();

        assertEquals("https://lms.example.com", config.getBaseUrl());
        assertEquals(Config.DEFAULT_API_PREFIX, config.getApiPrefix());
        assertEquals(10, config.getMaxConcurrent());
        assertEquals(Duration.ofMillis(200), config.getMinSpacing());
        assertEquals(100, config.getPerPage());
        assertEquals(40, config.getMaxBatchSize());
        assertEquals(Duration.ofMillis(300), config.getBatchDelay());
        assertEquals(Duration.ofMillis(500), config.getKeyBatchDelay());
        assertEquals(5, config.getMaxRetries());
        assertEquals(Config.DEFAULT_HTTP_TIMEOUT, config.getHttpTimeout());
        assertNotNull(config.getHttpClient());
        assertNull(config.getTransport());
    }

    @Test
    void honoursOverrides() {
        Config config = Config.builder()
            .baseUrl("https://lms.example.com")
            .accessToken("token")
            .apiPrefix("api/v2/")
            .maxConcurrent(3)
            .minSpacing(Duration.ZERO)
            .perPage(50)
            .maxBatchSize(5)
            .batchDelay(Duration.ZERO)
            .keyBatchDelay(Duration.ofMillis(10))
            .maxRetries(0)
            .httpTimeout(Duration.ofSeconds(5))
            .build();

        assertEquals("/api/v2", config.getApiPrefix());
        assertEquals(3, config.getMaxConcurrent());
        assertEquals(Duration.ZERO, config.getMinSpacing());
        assertEquals(50, config.getPerPage());
        assertEquals(5, config.getMaxBatchSize());
        assertEquals(Duration.ZERO, config.getBatchDelay());
        assertEquals(Duration.ofMillis(10), config.getKeyBatchDelay());
        assertEquals(0, config.getMaxRetries());
        assertEquals(Duration.ofSeconds(5), config.getHttpTimeout());
    }

    @Test
    void invalidValuesFallBackToDefaults() {
        Config config = Config.builder()
            .baseUrl("https://lms.example.com")
            .accessToken("token")
            .maxConcurrent(-1)
            .minSpacing(Duration.ofMillis(-5))
            .perPage(0)
            .httpTimeout(Duration.ZERO)
            .build();

        assertEquals(Config.DEFAULT_MAX_CONCURRENT, config.getMaxConcurrent());
        assertEquals(Config.DEFAULT_MIN_SPACING, config.getMinSpacing());
        assertEquals(Config.DEFAULT_PER_PAGE, config.getPerPage());
        assertEquals(Config.DEFAULT_HTTP_TIMEOUT, config.getHttpTimeout());
    }

    @Test
    void rejectsMissingOrInvalidSettings() {
        assertThrows(IllegalArgumentException.class,
            () -> Config.builder().baseUrl("lms.example.com").accessToken("token").build());
        assertThrows(IllegalArgumentException.class,
            () -> Config.builder().accessToken("token").build());
        assertThrows(IllegalArgumentException.class,
            () -> Config.builder().baseUrl("https://lms.example.com").accessToken(" ").build());
    }

    @Test
    void readsEnvironment() {
        Config config = Config.builder()
            .fromEnvironment(Map.of(
                Config.ENV_DOMAIN, "https://school.instructure.test",
                Config.ENV_ACCESS_TOKEN, "env-token"))
            .build();

        assertEquals("https://school.instructure.test", config.getBaseUrl());
        assertEquals("env-token", config.getAccessToken());
    }

    @Test
    void listOptionsResolveAgainstClientDefaults() {
        ListOptions resolved = ListOptions.builder()
            .perPage(25)
            .build()
            .withDefaults(100, 40, Duration.ofMillis(300));

        assertEquals(25, resolved.getPerPage());
        assertEquals(40, resolved.getMaxBatchSize());
        assertEquals(Duration.ofMillis(300), resolved.getBatchDelay());
        assertTrue(resolved.hasQuery("https://lms.test/a?x=1"));
        assertFalse(resolved.hasQuery("https://lms.test/a"));
        assertFalse(ListOptions.builder().hasQuery(false).build().hasQuery("https://lms.test/a?x=1"));
    }
}
