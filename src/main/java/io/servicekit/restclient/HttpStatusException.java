package io.servicekit.restclient;

import java.net.URI;
import java.nio.charset.StandardCharsets;

/**
 * Raised when the remote service answers with a non-2xx status. Both the status and the raw body are kept so callers
 * can inspect what the service actually returned; {@link #getDetail()} holds the error message decoded from a JSON
 * error body when one was present.
 */
public final class HttpStatusException extends RestClientException {

    private static final long serialVersionUID = 1L;

    private final int statusCode;
    private final byte[] body;
    private final String detail;
    private final int attempts;

    public HttpStatusException(String method, URI uri, int statusCode, byte[] body, String detail, int attempts) {
        super(describe(method, uri) + defaultMessage(statusCode, detail), method, uri, null);
        this.statusCode = statusCode;
        this.body = body == null ? new byte[0] : body.clone();
        this.detail = detail;
        this.attempts = attempts;
    }

    /**
     * @return HTTP status code returned by the remote service.
     */
    public int getStatusCode() {
        return statusCode;
    }

    /**
     * @return copy of the raw response body (empty when the response had none).
     */
    public byte[] getBody() {
        return body.clone();
    }

    public String getBodyAsString() {
        return new String(body, StandardCharsets.UTF_8);
    }

    /**
     * @return error message decoded from the response body, or {@code null} when the body carried none.
     */
    public String getDetail() {
        return detail;
    }

    public int getAttempts() {
        return attempts;
    }

    private static String defaultMessage(int status, String detail) {
        if (detail == null || detail.isBlank()) {
            return "request failed with status " + status;
        }
        return "request failed with status " + status + " (" + detail + ")";
    }
}
