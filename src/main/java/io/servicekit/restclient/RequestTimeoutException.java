package io.servicekit.restclient;

import java.io.IOException;
import java.net.URI;

/**
 * Raised when the last attempt of a call exceeded the configured timeout.
 */
public final class RequestTimeoutException extends RestClientException {

    private static final long serialVersionUID = 1L;

    private final int attempts;

    public RequestTimeoutException(String method, URI uri, IOException cause, int attempts) {
        super(describe(method, uri) + "timed out after " + attempts + " attempt(s)", method, uri, cause);
        this.attempts = attempts;
    }

    public int getAttempts() {
        return attempts;
    }
}
