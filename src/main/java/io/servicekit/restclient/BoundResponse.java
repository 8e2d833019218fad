package io.servicekit.restclient;

import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Successful, schema-validated result of a call.
 *
 * @param status HTTP status of the response (always 2xx).
 * @param headers response headers as received.
 * @param value body bound against the requested shape.
 * @param attempts number of attempts the call needed.
 * @param <T> type of the bound body.
 */
public record BoundResponse<T>(int status, Map<String, List<String>> headers, T value, int attempts) {

    public BoundResponse {
        headers = headers == null ? Map.of() : Map.copyOf(headers);
    }

    /**
     * @return first value of header {@code name}, matched case-insensitively.
     */
    public Optional<String> header(String name) {
        for (Map.Entry<String, List<String>> entry : headers.entrySet()) {
            if (entry.getKey().equalsIgnoreCase(name) && !entry.getValue().isEmpty()) {
                return Optional.of(entry.getValue().get(0));
            }
        }
        return Optional.empty();
    }
}
