package io.servicekit.restclient.request;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * Call-site arguments of one request: query parameters, extra headers and an optional body.
 *
 * <pre>{@code
 * RequestOptions options = RequestOptions.builder()
 *     .query("page", "2")
 *     .header("Idempotency-Key", key)
 *     .body(newUser)
 *     .build();
 * }</pre>
 */
public final class RequestOptions {

    private static final RequestOptions NONE = builder().build();

    private final Map<String, String> query;
    private final Map<String, String> headers;
    private final Object body;

    private RequestOptions(Builder builder) {
        this.query = Collections.unmodifiableMap(new LinkedHashMap<>(builder.query));
        this.headers = Collections.unmodifiableMap(new LinkedHashMap<>(builder.headers));
        this.body = builder.body;
    }

    public static RequestOptions none() {
        return NONE;
    }

    public static Builder builder() {
        return new Builder();
    }

    /**
     * Shorthand for options carrying only a body.
     */
    public static RequestOptions body(Object body) {
        return builder().body(body).build();
    }

    public Map<String, String> getQuery() {
        return query;
    }

    public Map<String, String> getHeaders() {
        return headers;
    }

    public Object getBody() {
        return body;
    }

    public static final class Builder {
        private final Map<String, String> query = new LinkedHashMap<>();
        private final Map<String, String> headers = new LinkedHashMap<>();
        private Object body;

        private Builder() {
        }

        public Builder query(String name, String value) {
            Objects.requireNonNull(name, "name");
            Objects.requireNonNull(value, "value");
            query.put(name, value);
            return this;
        }

        public Builder query(Map<String, String> values) {
            if (values != null) {
                values.forEach(this::query);
            }
            return this;
        }

        public Builder header(String name, String value) {
            Objects.requireNonNull(name, "name");
            Objects.requireNonNull(value, "value");
            headers.put(name, value);
            return this;
        }

        public Builder headers(Map<String, String> values) {
            if (values != null) {
                values.forEach(this::header);
            }
            return this;
        }

        /**
         * Sets the request body. Objects are serialized as JSON unless the {@code Content-Type} header says
         * otherwise; {@code byte[]} and {@code String} bodies are sent as-is.
         */
        public Builder body(Object body) {
            this.body = body;
            return this;
        }

        public RequestOptions build() {
            return new RequestOptions(this);
        }
    }
}
