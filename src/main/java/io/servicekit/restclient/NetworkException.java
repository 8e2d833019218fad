package io.servicekit.restclient;

import java.io.IOException;
import java.net.URI;

/**
 * Raised when a connection could not be established or was reset. The underlying {@link IOException} is attached as
 * the cause.
 */
public final class NetworkException extends RestClientException {

    private static final long serialVersionUID = 1L;

    private final int attempts;

    public NetworkException(String method, URI uri, IOException cause, int attempts) {
        super(describe(method, uri) + "network error after " + attempts + " attempt(s): " + cause.getMessage(),
            method, uri, cause);
        this.attempts = attempts;
    }

    /**
     * @return number of attempts made before giving up.
     */
    public int getAttempts() {
        return attempts;
    }
}
