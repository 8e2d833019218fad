package io.servicekit.restclient.request;

import io.servicekit.restclient.schema.Shape;

import java.net.URI;
import java.util.Collections;
import java.util.Map;
import java.util.Objects;
import java.util.TreeMap;

/**
 * Fully resolved, immutable description of one call. Every attempt of the call is built from the same spec, so
 * retries send identical method, URI, headers and body.
 *
 * @param <T> type the response body is bound to.
 */
public final class RequestSpec<T> {

    private final HttpMethod method;
    private final URI uri;
    private final Map<String, String> headers;
    private final byte[] body;
    private final Shape<T> responseShape;

    public RequestSpec(HttpMethod method, URI uri, Map<String, String> headers, byte[] body, Shape<T> responseShape) {
        this.method = Objects.requireNonNull(method, "method");
        this.uri = Objects.requireNonNull(uri, "uri");
        Map<String, String> copy = new TreeMap<>(String.CASE_INSENSITIVE_ORDER);
        if (headers != null) {
            copy.putAll(headers);
        }
        this.headers = Collections.unmodifiableMap(copy);
        this.body = body == null ? null : body.clone();
        this.responseShape = Objects.requireNonNull(responseShape, "responseShape");
    }

    public HttpMethod method() {
        return method;
    }

    public URI uri() {
        return uri;
    }

    /**
     * @return unmodifiable, case-insensitive header map.
     */
    public Map<String, String> headers() {
        return headers;
    }

    public String header(String name) {
        return headers.get(name);
    }

    public boolean hasBody() {
        return body != null;
    }

    /**
     * @return copy of the encoded body, or {@code null} when the request has none.
     */
    public byte[] body() {
        return body == null ? null : body.clone();
    }

    public Shape<T> responseShape() {
        return responseShape;
    }

    @Override
    public String toString() {
        return method + " " + uri;
    }
}
