package io.servicekit.restclient;

/**
 * Raised when a request body cannot be serialized for the declared content type. Never retried.
 */
public final class EncodingException extends RestClientException {

    private static final long serialVersionUID = 1L;

    public EncodingException(String message) {
        super(message);
    }

    public EncodingException(String message, Throwable cause) {
        super(message, cause);
    }
}
