package io.servicekit.restclient;

import io.servicekit.restclient.auth.Credentials;
import io.servicekit.restclient.retry.RetryPolicy;

import java.net.URI;
import java.net.URISyntaxException;
import java.net.http.HttpClient;
import java.time.Duration;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.Properties;
import java.util.Set;

/**
 * Immutable configuration of one {@link RestClient} or {@link AsyncRestClient}.
 *
 * <pre>{@code
 * ClientConfig config = ClientConfig.builder()
 *     .baseUrl("https://inventory.internal/api/v1")
 *     .defaultHeader("X-Service", "orders")
 *     .credentials(Credentials.bearer(token))
 *     .timeout(Duration.ofSeconds(5))
 *     .maxRetries(2)
 *     .build();
 * }</pre>
 */
public final class ClientConfig {

    public static final Duration DEFAULT_TIMEOUT = Duration.ofSeconds(10);
    public static final int DEFAULT_MAX_RETRIES = RetryPolicy.DEFAULT_MAX_RETRIES;
    public static final Duration DEFAULT_BACKOFF_BASE = RetryPolicy.DEFAULT_BACKOFF_BASE;
    public static final Duration DEFAULT_BACKOFF_CAP = RetryPolicy.DEFAULT_BACKOFF_CAP;

    private final String baseUrl;
    private final Map<String, String> defaultHeaders;
    private final Credentials credentials;
    private final Duration timeout;
    private final int maxRetries;
    private final Duration backoffBase;
    private final Duration backoffCap;
    private final Set<Integer> retryableStatuses;
    private final HttpClient httpClient;

    private ClientConfig(Builder builder) {
        this.baseUrl = builder.baseUrl;
        this.defaultHeaders = Collections.unmodifiableMap(new LinkedHashMap<>(builder.defaultHeaders));
        this.credentials = builder.credentials;
        this.timeout = builder.timeout;
        this.maxRetries = builder.maxRetries == null ? DEFAULT_MAX_RETRIES : builder.maxRetries;
        this.backoffBase = builder.backoffBase;
        this.backoffCap = builder.backoffCap;
        this.retryableStatuses = builder.retryableStatuses == null
            ? null : Collections.unmodifiableSet(new LinkedHashSet<>(builder.retryableStatuses));
        this.httpClient = builder.httpClient;
    }

    public static Builder builder() {
        return new Builder();
    }

    /**
     * Reads a configuration from {@code properties}, using keys below {@code prefix}:
     * {@code base-url} (required), {@code timeout-ms}, {@code max-retries}, {@code backoff-base-ms},
     * {@code backoff-cap-ms}, {@code retryable-statuses} (comma separated) and {@code header.<Name>}.
     */
    public static ClientConfig fromProperties(String prefix, Properties properties) {
        String root = prefix == null || prefix.isBlank() ? "" : (prefix.endsWith(".") ? prefix : prefix + ".");
        Builder builder = builder().baseUrl(properties.getProperty(root + "base-url"));

        optionalLong(properties, root + "timeout-ms").ifPresent(ms -> builder.timeout(Duration.ofMillis(ms)));
        optionalLong(properties, root + "max-retries").ifPresent(n -> builder.maxRetries(Math.toIntExact(n)));
        optionalLong(properties, root + "backoff-base-ms").ifPresent(ms -> builder.backoffBase(Duration.ofMillis(ms)));
        optionalLong(properties, root + "backoff-cap-ms").ifPresent(ms -> builder.backoffCap(Duration.ofMillis(ms)));

        String statuses = properties.getProperty(root + "retryable-statuses");
        if (statuses != null && !statuses.isBlank()) {
            Set<Integer> parsed = new LinkedHashSet<>();
            for (String status : statuses.split(",")) {
                if (!status.isBlank()) {
                    parsed.add(parseNumber(root + "retryable-statuses", status).intValue());
                }
            }
            builder.retryableStatuses(parsed);
        }

        String headerPrefix = root + "header.";
        for (String name : properties.stringPropertyNames()) {
            if (name.startsWith(headerPrefix) && name.length() > headerPrefix.length()) {
                builder.defaultHeader(name.substring(headerPrefix.length()), properties.getProperty(name));
            }
        }
        return builder.build();
    }

    ClientConfig withDefaults() {
        String resolvedBaseUrl = sanitizeUrl(baseUrl);

        Duration resolvedTimeout = Optional.ofNullable(timeout).orElse(DEFAULT_TIMEOUT);
        if (resolvedTimeout.isNegative() || resolvedTimeout.isZero()) {
            throw new IllegalArgumentException("timeout must be positive");
        }
        if (maxRetries < 0) {
            throw new IllegalArgumentException("maxRetries cannot be negative");
        }
        Duration resolvedBase = Optional.ofNullable(backoffBase).orElse(DEFAULT_BACKOFF_BASE);
        if (resolvedBase.isNegative()) {
            throw new IllegalArgumentException("backoffBase cannot be negative");
        }
        Duration resolvedCap = Optional.ofNullable(backoffCap).orElse(DEFAULT_BACKOFF_CAP);
        if (resolvedCap.compareTo(resolvedBase) < 0) {
            throw new IllegalArgumentException("backoffCap cannot be smaller than backoffBase");
        }
        if (retryableStatuses != null) {
            for (Integer status : retryableStatuses) {
                if (status == null || status < 100 || status > 599) {
                    throw new IllegalArgumentException("invalid retryable status " + status);
                }
            }
        }
        for (Map.Entry<String, String> header : defaultHeaders.entrySet()) {
            if (header.getKey() == null || header.getKey().isBlank() || header.getValue() == null) {
                throw new IllegalArgumentException("default headers need a name and a value");
            }
        }

        HttpClient resolvedClient = httpClient;
        if (resolvedClient == null) {
            resolvedClient = HttpClient.newBuilder()
                .connectTimeout(resolvedTimeout)
                .followRedirects(HttpClient.Redirect.NEVER)
                .build();
        }

        Builder resolved = new Builder()
            .baseUrl(resolvedBaseUrl)
            .defaultHeaders(defaultHeaders)
            .credentials(credentials)
            .timeout(resolvedTimeout)
            .maxRetries(maxRetries)
            .backoffBase(resolvedBase)
            .backoffCap(resolvedCap)
            .httpClient(resolvedClient);
        if (retryableStatuses != null) {
            resolved.retryableStatuses(retryableStatuses);
        }
        return resolved.buildInternal();
    }

    /**
     * Builds the retry policy these settings describe.
     */
    public RetryPolicy retryPolicy() {
        return RetryPolicy.of(maxRetries, backoffBase, backoffCap, retryableStatuses);
    }

    private static String sanitizeUrl(String url) {
        String trimmed = Optional.ofNullable(url).map(String::trim).orElse("");
        if (trimmed.isEmpty()) {
            throw new IllegalArgumentException("baseUrl is required");
        }
        try {
            URI uri = new URI(trimmed);
            if (uri.getScheme() == null || uri.getHost() == null) {
                throw new IllegalArgumentException("URL must include scheme and host");
            }
            String scheme = uri.getScheme().toLowerCase(Locale.ROOT);
            if (!scheme.equals("http") && !scheme.equals("https")) {
                throw new IllegalArgumentException("URL scheme must be http or https: " + trimmed);
            }
            if (uri.getRawQuery() != null || uri.getRawFragment() != null) {
                throw new IllegalArgumentException("base URL cannot carry a query or fragment: " + trimmed);
            }
        } catch (URISyntaxException ex) {
            throw new IllegalArgumentException("Invalid URL: " + trimmed, ex);
        }
        if (trimmed.endsWith("/")) {
            return trimmed.substring(0, trimmed.length() - 1);
        }
        return trimmed;
    }

    private static Optional<Long> optionalLong(Properties properties, String key) {
        String value = properties.getProperty(key);
        if (value == null || value.isBlank()) {
            return Optional.empty();
        }
        return Optional.of(parseNumber(key, value));
    }

    private static Long parseNumber(String key, String value) {
        try {
            return Long.parseLong(value.trim());
        } catch (NumberFormatException ex) {
            throw new IllegalArgumentException("property " + key + " must be a number: " + value, ex);
        }
    }

    public String getBaseUrl() {
        return baseUrl;
    }

    public Map<String, String> getDefaultHeaders() {
        return defaultHeaders;
    }

    public Credentials getCredentials() {
        return credentials;
    }

    public Duration getTimeout() {
        return timeout;
    }

    public int getMaxRetries() {
        return maxRetries;
    }

    public Duration getBackoffBase() {
        return backoffBase;
    }

    public Duration getBackoffCap() {
        return backoffCap;
    }

    /**
     * @return explicitly configured retryable statuses, or {@code null} for the default (429 and 5xx).
     */
    public Set<Integer> getRetryableStatuses() {
        return retryableStatuses;
    }

    public HttpClient getHttpClient() {
        return httpClient;
    }

    public static final class Builder {
        private String baseUrl;
        private final Map<String, String> defaultHeaders = new LinkedHashMap<>();
        private Credentials credentials;
        private Duration timeout;
        private Integer maxRetries;
        private Duration backoffBase;
        private Duration backoffCap;
        private Set<Integer> retryableStatuses;
        private HttpClient httpClient;

        public Builder baseUrl(String baseUrl) {
            this.baseUrl = baseUrl;
            return this;
        }

        public Builder defaultHeader(String name, String value) {
            this.defaultHeaders.put(name, value);
            return this;
        }

        public Builder defaultHeaders(Map<String, String> headers) {
            if (headers != null) {
                this.defaultHeaders.putAll(headers);
            }
            return this;
        }

        public Builder credentials(Credentials credentials) {
            this.credentials = credentials;
            return this;
        }

        public Builder timeout(Duration timeout) {
            this.timeout = timeout;
            return this;
        }

        public Builder maxRetries(int maxRetries) {
            this.maxRetries = maxRetries;
            return this;
        }

        public Builder backoffBase(Duration backoffBase) {
            this.backoffBase = backoffBase;
            return this;
        }

        public Builder backoffCap(Duration backoffCap) {
            this.backoffCap = backoffCap;
            return this;
        }

        public Builder retryableStatuses(Set<Integer> retryableStatuses) {
            this.retryableStatuses = retryableStatuses == null ? null : new LinkedHashSet<>(retryableStatuses);
            return this;
        }

        /**
         * Supplies the JDK client, and with it the connection pool, proxy and TLS settings (for example a custom
         * {@code SSLContext}). When absent a client with a connect timeout equal to the request timeout is created; it
         * never follows redirects, so a 3xx answer surfaces as {@link HttpStatusException}.
         */
        public Builder httpClient(HttpClient httpClient) {
            this.httpClient = httpClient;
            return this;
        }

        public ClientConfig build() {
            return new ClientConfig(this).withDefaults();
        }

        private ClientConfig buildInternal() {
            return new ClientConfig(this);
        }
    }
}
