package io.servicekit.restclient;

import java.net.URI;

/**
 * Base exception thrown by the REST client. Every failure reported to a caller is one of its subclasses, so a single
 * {@code catch (RestClientException ex)} covers encoding, transport, status, validation and cancellation errors.
 */
public class RestClientException extends Exception {

    private static final long serialVersionUID = 1L;

    private final String method;
    private final URI uri;

    public RestClientException(String message) {
        this(message, null, null, null);
    }

    public RestClientException(String message, Throwable cause) {
        this(message, null, null, cause);
    }

    public RestClientException(String message, String method, URI uri, Throwable cause) {
        super(message, cause);
        this.method = method;
        this.uri = uri;
    }

    /**
     * @return HTTP method of the failed call, or {@code null} when the failure happened before a request existed.
     */
    public String getMethod() {
        return method;
    }

    /**
     * @return target URI of the failed call, or {@code null} when the failure happened before a request existed.
     */
    public URI getUri() {
        return uri;
    }

    static String describe(String method, URI uri) {
        if (method == null || uri == null) {
            return "";
        }
        return method + " " + uri + ": ";
    }
}
