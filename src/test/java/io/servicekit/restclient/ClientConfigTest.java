package io.servicekit.restclient;

import org.junit.jupiter.api.Test;

import java.net.http.HttpClient;
import java.time.Duration;
import java.util.Map;
import java.util.Properties;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;

class ClientConfigTest {

    @Test
    void appliesDefaults() {
        ClientConfig config = ClientConfig.builder().baseUrl(" https://api.example.test/v1/ ").build();

        assertEquals("https://api.example.test/v1", config.getBaseUrl());
        assertEquals(Duration.ofSeconds(10), config.getTimeout());
        assertEquals(3, config.getMaxRetries());
        assertEquals(Duration.ofMillis(500), config.getBackoffBase());
        assertEquals(Duration.ofSeconds(30), config.getBackoffCap());
        assertNull(config.getRetryableStatuses());
        assertNotNull(config.getHttpClient());
        assertEquals(HttpClient.Redirect.NEVER, config.getHttpClient().followRedirects());
        assertEquals(Map.of(), config.getDefaultHeaders());
    }

    @Test
    void buildsRetryPolicyFromSettings() {
        ClientConfig config = ClientConfig.builder()
            .baseUrl("http://localhost:8080")
            .maxRetries(1)
            .backoffBase(Duration.ofMillis(100))
            .backoffCap(Duration.ofMillis(150))
            .retryableStatuses(Set.of(502))
            .build();

        assertEquals(1, config.retryPolicy().maxRetries());
        assertEquals(Duration.ofMillis(150), config.retryPolicy().backoff(3));
    }

    @Test
    void rejectsInvalidSettings() {
        assertThrows(IllegalArgumentException.class, () -> ClientConfig.builder().build());
        assertThrows(IllegalArgumentException.class, () -> ClientConfig.builder().baseUrl("ftp://files.test").build());
        assertThrows(IllegalArgumentException.class, () -> ClientConfig.builder().baseUrl("localhost").build());
        assertThrows(IllegalArgumentException.class,
            () -> ClientConfig.builder().baseUrl("https://api.test/v1?x=1").build());
        assertThrows(IllegalArgumentException.class,
            () -> ClientConfig.builder().baseUrl("https://api.test").timeout(Duration.ZERO).build());
        assertThrows(IllegalArgumentException.class,
            () -> ClientConfig.builder().baseUrl("https://api.test").maxRetries(-1).build());
        assertThrows(IllegalArgumentException.class, () -> ClientConfig.builder().baseUrl("https://api.test")
            .backoffBase(Duration.ofSeconds(2)).backoffCap(Duration.ofSeconds(1)).build());
        assertThrows(IllegalArgumentException.class,
            () -> ClientConfig.builder().baseUrl("https://api.test").retryableStatuses(Set.of(42)).build());
    }

    @Test
    void readsPrefixedProperties() {
        Properties properties = new Properties();
        properties.setProperty("inventory.base-url", "https://inventory.test/api");
        properties.setProperty("inventory.timeout-ms", "2500");
        properties.setProperty("inventory.max-retries", "5");
        properties.setProperty("inventory.backoff-base-ms", "200");
        properties.setProperty("inventory.backoff-cap-ms", "4000");
        properties.setProperty("inventory.retryable-statuses", "429, 503");
        properties.setProperty("inventory.header.X-Service", "orders");
        properties.setProperty("billing.base-url", "https://billing.test");

        ClientConfig config = ClientConfig.fromProperties("inventory", properties);

        assertEquals("https://inventory.test/api", config.getBaseUrl());
        assertEquals(Duration.ofMillis(2500), config.getTimeout());
        assertEquals(5, config.getMaxRetries());
        assertEquals(Duration.ofMillis(200), config.getBackoffBase());
        assertEquals(Duration.ofMillis(4000), config.getBackoffCap());
        assertEquals(Set.of(429, 503), config.getRetryableStatuses());
        assertEquals(Map.of("X-Service", "orders"), config.getDefaultHeaders());
    }

    @Test
    void rejectsNonNumericProperties() {
        Properties properties = new Properties();
        properties.setProperty("base-url", "https://api.test");
        properties.setProperty("timeout-ms", "soon");

        assertThrows(IllegalArgumentException.class, () -> ClientConfig.fromProperties(null, properties));
    }
}
