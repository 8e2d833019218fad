package io.servicekit.restclient.schema;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.MissingNode;
import io.servicekit.restclient.ValidationException;
import io.servicekit.restclient.internal.Json;

import java.io.IOException;
import java.util.Objects;

/**
 * Parses response bytes as JSON and binds them against a declared {@link Shape}.
 */
public final class SchemaBinder {

    private final ObjectMapper mapper;

    public SchemaBinder() {
        this(Json.mapper());
    }

    public SchemaBinder(ObjectMapper mapper) {
        this.mapper = Objects.requireNonNull(mapper, "mapper");
    }

    /**
     * Binds {@code body} against {@code shape}.
     *
     * @param body raw response body; an empty array is treated as an absent document.
     * @param shape expected structure.
     * @return the bound value.
     * @throws ValidationException when the body is not JSON or does not match the shape.
     */
    public <T> T bind(byte[] body, Shape<T> shape) throws ValidationException {
        Objects.requireNonNull(shape, "shape");
        if (!shape.readsBody()) {
            return shape.bind(MissingNode.getInstance(), Paths.ROOT);
        }
        return shape.bind(parse(body), Paths.ROOT);
    }

    private JsonNode parse(byte[] body) throws ValidationException {
        if (body == null || body.length == 0) {
            return MissingNode.getInstance();
        }
        try {
            JsonNode node = mapper.readTree(body);
            return node == null ? MissingNode.getInstance() : node;
        } catch (IOException ex) {
            throw new ValidationException(Paths.ROOT, "json", "malformed document", ex);
        }
    }
}
