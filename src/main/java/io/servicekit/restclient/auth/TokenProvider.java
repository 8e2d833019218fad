package io.servicekit.restclient.auth;

import io.servicekit.restclient.RestClientException;

/**
 * Source of bearer tokens for {@link Credentials#tokens(TokenProvider)}. The client asks for a token once per call,
 * so implementations should cache and only go back to the issuer when the cached token is about to expire.
 */
@FunctionalInterface
public interface TokenProvider {

    /**
     * @return a token valid for at least the duration of one call.
     * @throws RestClientException when no token can be obtained; the call then fails before any request is sent.
     */
    Token token() throws RestClientException;

    /**
     * Drops any cached token so the next {@link #token()} fetches a new one.
     */
    default void invalidate() {
    }

    default Token forceRefresh() throws RestClientException {
        invalidate();
        return token();
    }
}
