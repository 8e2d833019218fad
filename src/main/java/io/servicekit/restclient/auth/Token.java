package io.servicekit.restclient.auth;

import java.time.Instant;
import java.util.Objects;

/**
 * An issued access token and the instant after which it must not be used.
 */
public final class Token {

    private final String accessToken;
    private final String tokenType;
    private final String scope;
    private final Instant expiry;

    public Token(String accessToken, String tokenType, String scope, Instant expiry) {
        this.accessToken = Objects.requireNonNull(accessToken, "accessToken");
        this.tokenType = tokenType == null || tokenType.isBlank() ? "Bearer" : tokenType;
        this.scope = scope;
        this.expiry = Objects.requireNonNull(expiry, "expiry");
    }

    public String getAccessToken() {
        return accessToken;
    }

    public String getTokenType() {
        return tokenType;
    }

    /**
     * @return scope granted by the authorization server (nullable when it did not report one).
     */
    public String getScope() {
        return scope;
    }

    public Instant getExpiry() {
        return expiry;
    }

    @Override
    public String toString() {
        return "Token[type=" + tokenType + ", expiry=" + expiry + "]";
    }
}
