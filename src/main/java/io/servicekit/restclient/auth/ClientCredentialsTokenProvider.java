package io.servicekit.restclient.auth;

import com.fasterxml.jackson.databind.JsonNode;
import io.servicekit.restclient.HttpStatusException;
import io.servicekit.restclient.NetworkException;
import io.servicekit.restclient.RequestCancelledException;
import io.servicekit.restclient.RequestTimeoutException;
import io.servicekit.restclient.RestClientException;
import io.servicekit.restclient.ValidationException;
import io.servicekit.restclient.internal.HttpErrorDecoder;
import io.servicekit.restclient.internal.Json;

import java.io.IOException;
import java.net.URI;
import java.net.URLEncoder;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.net.http.HttpTimeoutException;
import java.nio.charset.StandardCharsets;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Base64;
import java.util.Collections;
import java.util.List;
import java.util.Locale;
import java.util.Objects;
import java.util.concurrent.locks.ReentrantLock;
import java.util.logging.Logger;

/**
 * TokenProvider implementation performing the OAuth2 client credentials grant.
 *
 * <p>
 * Tokens are cached and refreshed once they come within {@code leeway} of their expiry, so concurrent callers share a
 * single token request. Failures are reported with the same exception types as ordinary calls: an unreachable
 * authorization server yields {@link NetworkException}, a rejected grant {@link HttpStatusException}, and a response
 * without {@code access_token} {@link ValidationException}.
 * </p>
 */
public final class ClientCredentialsTokenProvider implements TokenProvider {

    private static final Logger LOGGER = Logger.getLogger(ClientCredentialsTokenProvider.class.getName());
    private static final Duration DEFAULT_LEEWAY = Duration.ofSeconds(30);
    private static final Duration DEFAULT_TIMEOUT = Duration.ofSeconds(30);
    private static final int DEFAULT_EXPIRES_IN = 60;

    private final HttpClient httpClient;
    private final URI tokenUri;
    private final String clientId;
    private final String clientSecret;
    private final String scope;
    private final List<String> audience;
    private final Duration leeway;
    private final Duration requestTimeout;
    private final Clock clock;

    private final ReentrantLock lock = new ReentrantLock();
    private volatile Token cached;

    public ClientCredentialsTokenProvider(
        HttpClient httpClient,
        String tokenUrl,
        String clientId,
        String clientSecret,
        String scope,
        List<String> audience,
        Duration leeway,
        Duration requestTimeout
    ) {
        this(httpClient, tokenUrl, clientId, clientSecret, scope, audience, leeway, requestTimeout, Clock.systemUTC());
    }

    ClientCredentialsTokenProvider(
        HttpClient httpClient,
        String tokenUrl,
        String clientId,
        String clientSecret,
        String scope,
        List<String> audience,
        Duration leeway,
        Duration requestTimeout,
        Clock clock
    ) {
        this.httpClient = Objects.requireNonNull(httpClient, "httpClient");
        this.tokenUri = URI.create(Objects.requireNonNull(tokenUrl, "tokenUrl"));
        this.clientId = Objects.requireNonNull(clientId, "clientId");
        this.clientSecret = Objects.requireNonNull(clientSecret, "clientSecret");
        this.scope = scope;
        this.audience = audience == null ? Collections.emptyList() : List.copyOf(audience);
        this.leeway = leeway == null || leeway.isZero() || leeway.isNegative() ? DEFAULT_LEEWAY : leeway;
        this.requestTimeout = requestTimeout == null || requestTimeout.isZero() || requestTimeout.isNegative()
            ? DEFAULT_TIMEOUT : requestTimeout;
        this.clock = Objects.requireNonNull(clock, "clock");
    }

    @Override
    public Token token() throws RestClientException {
        Token current = cached;
        if (current != null && isFresh(current)) {
            return current;
        }

        lock.lock();
        try {
            current = cached;
            if (current != null && isFresh(current)) {
                return current;
            }

            Token fresh = fetchToken();
            cached = fresh;
            return fresh;
        } finally {
            lock.unlock();
        }
    }

    @Override
    public void invalidate() {
        cached = null;
    }

    @Override
    public Token forceRefresh() throws RestClientException {
        lock.lock();
        try {
            Token fresh = fetchToken();
            cached = fresh;
            return fresh;
        } finally {
            lock.unlock();
        }
    }

    private boolean isFresh(Token token) {
        Instant refreshAt = token.getExpiry().minus(leeway);
        return clock.instant().isBefore(refreshAt);
    }

    private Token fetchToken() throws RestClientException {
        LOGGER.fine(() -> "[rest-client] requesting client credentials token from " + tokenUri);
        HttpResponse<byte[]> response;
        try {
            response = httpClient.send(tokenRequest(), HttpResponse.BodyHandlers.ofByteArray());
        } catch (InterruptedException ex) {
            Thread.currentThread().interrupt();
            throw new RequestCancelledException("POST", tokenUri, ex);
        } catch (HttpTimeoutException ex) {
            throw new RequestTimeoutException("POST", tokenUri, ex, 1);
        } catch (IOException ex) {
            throw new NetworkException("POST", tokenUri, ex, 1);
        }

        byte[] body = response.body();
        if (response.statusCode() < 200 || response.statusCode() > 299) {
            String detail = HttpErrorDecoder.detail(body, response.headers().firstValue("Content-Type").orElse(null));
            throw new HttpStatusException("POST", tokenUri, response.statusCode(), body, detail, 1);
        }

        JsonNode node;
        try {
            node = Json.mapper().readTree(body);
        } catch (IOException ex) {
            throw new ValidationException("$", "json", "malformed document", ex);
        }
        if (node == null || !node.isObject()) {
            throw new ValidationException("$", "object", node == null ? "missing" : node.getNodeType().name()
                .toLowerCase(Locale.ROOT));
        }

        String accessToken = node.path("access_token").asText("");
        if (accessToken.isBlank()) {
            throw new ValidationException("access_token", "string", "missing");
        }

        int expiresIn = node.path("expires_in").canConvertToInt() ? node.path("expires_in").asInt() : DEFAULT_EXPIRES_IN;
        if (expiresIn <= 0) {
            expiresIn = DEFAULT_EXPIRES_IN;
        }
        Instant expiry = clock.instant().plusSeconds(expiresIn);
        String tokenType = node.hasNonNull("token_type") ? node.get("token_type").asText() : null;
        String grantedScope = node.hasNonNull("scope") ? node.get("scope").asText() : null;

        int lifetime = expiresIn;
        LOGGER.fine(() -> String.format(Locale.ROOT, "[rest-client] token issued, valid for %d s", lifetime));
        return new Token(accessToken, tokenType, grantedScope, expiry);
    }

    private HttpRequest tokenRequest() {
        StringBuilder form = new StringBuilder("grant_type=client_credentials");
        if (scope != null && !scope.isBlank()) {
            form.append("&scope=").append(URLEncoder.encode(scope, StandardCharsets.UTF_8));
        }
        for (String aud : audience) {
            if (aud == null || aud.isBlank()) {
                continue;
            }
            form.append("&audience=").append(URLEncoder.encode(aud.trim(), StandardCharsets.UTF_8));
        }

        String credentials = Base64.getEncoder()
            .encodeToString((clientId + ":" + clientSecret).getBytes(StandardCharsets.UTF_8));

        return HttpRequest.newBuilder()
            .uri(tokenUri)
            .POST(HttpRequest.BodyPublishers.ofString(form.toString()))
            .header("Content-Type", "application/x-www-form-urlencoded")
            .header("Accept", "application/json")
            .header("Authorization", "Basic " + credentials)
            .timeout(requestTimeout)
            .build();
    }
}
