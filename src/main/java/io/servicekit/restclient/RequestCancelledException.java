package io.servicekit.restclient;

import java.net.URI;

/**
 * Raised when the caller aborted a call, either through a {@link CancellationSignal}, by cancelling the returned
 * future, or by interrupting the calling thread of a blocking call.
 */
public final class RequestCancelledException extends RestClientException {

    private static final long serialVersionUID = 1L;

    public RequestCancelledException(String method, URI uri, Throwable cause) {
        super(describe(method, uri) + "call cancelled", method, uri, cause);
    }
}
