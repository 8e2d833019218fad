package io.servicekit.restclient.schema;

import com.fasterxml.jackson.databind.JsonNode;
import io.servicekit.restclient.ValidationException;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * JSON object with a declared set of fields. Fields not declared here are ignored when binding; declared fields are
 * bound in declaration order and the first mismatch is reported.
 *
 * <p>Instances are immutable: {@link #required} and {@link #optional} return extended copies, so a partially declared
 * shape can be shared as a base for several others.</p>
 */
public final class ObjectShape implements Shape<BoundObject> {

    static final ObjectShape EMPTY = new ObjectShape(List.of());

    private final List<Field> fields;

    private ObjectShape(List<Field> fields) {
        this.fields = fields;
    }

    /**
     * Declares a field that must be present; a JSON {@code null} is accepted only when {@code shape} allows it
     * (see {@link Shapes#nullable(Shape)}).
     */
    public ObjectShape required(String name, Shape<?> shape) {
        return with(new Field(name, shape, true, null));
    }

    /**
     * Declares a field that may be absent or {@code null}; it then binds to {@code null}.
     */
    public ObjectShape optional(String name, Shape<?> shape) {
        return with(new Field(name, shape, false, null));
    }

    /**
     * Declares a field that may be absent or {@code null}; it then binds to {@code defaultValue}.
     */
    public ObjectShape optional(String name, Shape<?> shape, Object defaultValue) {
        return with(new Field(name, shape, false, defaultValue));
    }

    public List<Field> fields() {
        return fields;
    }

    @Override
    public BoundObject bind(JsonNode node, String path) throws ValidationException {
        if (node == null || !node.isObject()) {
            throw new ValidationException(path, describe(), Paths.typeOf(node));
        }
        Map<String, Object> values = new LinkedHashMap<>();
        for (Field field : fields) {
            String fieldPath = Paths.field(path, field.name());
            JsonNode value = node.get(field.name());
            if (value == null || value.isMissingNode()) {
                if (field.required()) {
                    throw new ValidationException(fieldPath, field.shape().describe(), "missing");
                }
                values.put(field.name(), field.defaultValue());
                continue;
            }
            if (value.isNull() && !field.required()) {
                values.put(field.name(), field.defaultValue());
                continue;
            }
            values.put(field.name(), field.shape().bind(value, fieldPath));
        }
        return new BoundObject(values);
    }

    @Override
    public String describe() {
        return "object";
    }

    @Override
    public String toString() {
        StringBuilder out = new StringBuilder("{");
        for (int i = 0; i < fields.size(); i++) {
            Field field = fields.get(i);
            if (i > 0) {
                out.append(", ");
            }
            out.append(field.name()).append(field.required() ? ": " : "?: ").append(field.shape());
        }
        return out.append('}').toString();
    }

    private ObjectShape with(Field field) {
        for (Field existing : fields) {
            if (existing.name().equals(field.name())) {
                throw new IllegalArgumentException("field " + field.name() + " declared twice");
            }
        }
        List<Field> copy = new ArrayList<>(fields);
        copy.add(field);
        return new ObjectShape(Collections.unmodifiableList(copy));
    }

    /**
     * A declared field.
     */
    public record Field(String name, Shape<?> shape, boolean required, Object defaultValue) {
        public Field {
            Objects.requireNonNull(name, "name");
            Objects.requireNonNull(shape, "shape");
            if (name.isBlank()) {
                throw new IllegalArgumentException("field name must be non-empty");
            }
        }
    }
}
