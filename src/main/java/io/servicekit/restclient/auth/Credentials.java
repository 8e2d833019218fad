package io.servicekit.restclient.auth;

import io.servicekit.restclient.RestClientException;

import java.nio.charset.StandardCharsets;
import java.util.Base64;
import java.util.Map;
import java.util.Objects;

/**
 * Credential descriptor contributing authentication headers to every request of a client. Headers are resolved once
 * per call, before the first attempt, so all attempts of a call carry the same values.
 */
@FunctionalInterface
public interface Credentials {

    Map<String, String> headers() throws RestClientException;

    /**
     * {@code Authorization: Bearer <token>} with a fixed token.
     */
    static Credentials bearer(String token) {
        requireText(token, "token");
        Map<String, String> headers = Map.of("Authorization", "Bearer " + token);
        return () -> headers;
    }

    /**
     * HTTP basic authentication.
     */
    static Credentials basic(String username, String password) {
        requireText(username, "username");
        Objects.requireNonNull(password, "password");
        String encoded = Base64.getEncoder()
            .encodeToString((username + ":" + password).getBytes(StandardCharsets.UTF_8));
        Map<String, String> headers = Map.of("Authorization", "Basic " + encoded);
        return () -> headers;
    }

    /**
     * API key sent in a custom header, for example {@code X-Api-Key}.
     */
    static Credentials apiKey(String headerName, String key) {
        requireText(headerName, "headerName");
        requireText(key, "key");
        Map<String, String> headers = Map.of(headerName, key);
        return () -> headers;
    }

    /**
     * Bearer token obtained from {@code provider}, which is free to cache and refresh it.
     */
    static Credentials tokens(TokenProvider provider) {
        Objects.requireNonNull(provider, "provider");
        return () -> Map.of("Authorization", "Bearer " + provider.token().getAccessToken());
    }

    private static void requireText(String value, String name) {
        if (value == null || value.isBlank()) {
            throw new IllegalArgumentException(name + " is required");
        }
    }
}
