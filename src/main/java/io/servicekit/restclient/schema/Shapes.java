package io.servicekit.restclient.schema;

import com.fasterxml.jackson.databind.JsonNode;
import io.servicekit.restclient.ValidationException;

import java.math.BigDecimal;
import java.util.Objects;

/**
 * Factory for response shapes.
 *
 * <pre>{@code
 * record User(long id, String name, String email) { }
 *
 * Shape<User> user = Shapes.object()
 *     .required("id", Shapes.integer())
 *     .required("name", Shapes.string())
 *     .optional("email", Shapes.string(), "")
 *     .map(o -> new User(o.getLong("id"), o.getString("name"), o.getString("email")));
 *
 * Shape<List<User>> users = Shapes.list(user);
 * }</pre>
 */
public final class Shapes {

    private static final Shape<JsonNode> JSON = new Shape<>() {
        @Override
        public JsonNode bind(JsonNode node, String path) throws ValidationException {
            if (node == null || node.isMissingNode()) {
                throw new ValidationException(path, describe(), "missing");
            }
            return node;
        }

        @Override
        public String describe() {
            return "json";
        }
    };

    private static final Shape<Void> NONE = new Shape<>() {
        @Override
        public Void bind(JsonNode node, String path) {
            return null;
        }

        @Override
        public String describe() {
            return "none";
        }

        @Override
        public boolean readsBody() {
            return false;
        }
    };

    private Shapes() {
    }

    public static Shape<String> string() {
        return ScalarShape.STRING;
    }

    /**
     * JSON integral number bound to {@link Long}. Fractional numbers such as {@code 7.5} are rejected.
     */
    public static Shape<Long> integer() {
        return ScalarShape.INTEGER;
    }

    /**
     * Any JSON number bound to {@link Double}.
     */
    public static Shape<Double> number() {
        return ScalarShape.NUMBER;
    }

    /**
     * Any JSON number bound to {@link BigDecimal} without loss of precision.
     */
    public static Shape<BigDecimal> decimal() {
        return ScalarShape.DECIMAL;
    }

    public static Shape<Boolean> bool() {
        return ScalarShape.BOOLEAN;
    }

    /**
     * Starts an object shape with no fields; add them with {@link ObjectShape#required} and
     * {@link ObjectShape#optional}.
     */
    public static ObjectShape object() {
        return ObjectShape.EMPTY;
    }

    public static <E> ListShape<E> list(Shape<E> element) {
        return new ListShape<>(element);
    }

    /**
     * Wraps {@code shape} so that JSON {@code null} and an absent value (including an empty response body) bind to
     * {@code null}.
     */
    public static <T> Shape<T> nullable(Shape<T> shape) {
        Objects.requireNonNull(shape, "shape");
        return new Shape<>() {
            @Override
            public T bind(JsonNode node, String path) throws ValidationException {
                if (node == null || node.isMissingNode() || node.isNull()) {
                    return null;
                }
                return shape.bind(node, path);
            }

            @Override
            public String describe() {
                return shape.describe() + " or null";
            }
        };
    }

    /**
     * Accepts any JSON document and returns the parsed tree unchanged.
     */
    public static Shape<JsonNode> json() {
        return JSON;
    }

    /**
     * Ignores the response body; useful for {@code 204 No Content} answers.
     */
    public static Shape<Void> none() {
        return NONE;
    }
}
