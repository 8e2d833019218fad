package io.servicekit.restclient.schema;

import com.fasterxml.jackson.databind.JsonNode;
import io.servicekit.restclient.ValidationException;

import java.math.BigDecimal;
import java.util.function.Function;
import java.util.function.Predicate;

/**
 * Leaf shape accepting one JSON node type. Values are never coerced across types.
 */
final class ScalarShape<T> implements Shape<T> {

    static final ScalarShape<String> STRING = new ScalarShape<>("string", JsonNode::isTextual, JsonNode::textValue);
    static final ScalarShape<Boolean> BOOLEAN = new ScalarShape<>("boolean", JsonNode::isBoolean, JsonNode::booleanValue);
    static final ScalarShape<Long> INTEGER = new ScalarShape<>("integer",
        node -> node.isIntegralNumber() && node.canConvertToLong(), JsonNode::longValue);
    static final ScalarShape<Double> NUMBER = new ScalarShape<>("number", JsonNode::isNumber, JsonNode::doubleValue);
    static final ScalarShape<BigDecimal> DECIMAL = new ScalarShape<>("number", JsonNode::isNumber, JsonNode::decimalValue);

    private final String name;
    private final Predicate<JsonNode> accepts;
    private final Function<JsonNode, T> extractor;

    private ScalarShape(String name, Predicate<JsonNode> accepts, Function<JsonNode, T> extractor) {
        this.name = name;
        this.accepts = accepts;
        this.extractor = extractor;
    }

    @Override
    public T bind(JsonNode node, String path) throws ValidationException {
        if (node == null || !accepts.test(node)) {
            String actual = Paths.typeOf(node);
            if (node != null && node.isIntegralNumber() && "integer".equals(name)) {
                actual = "integer out of range";
            }
            throw new ValidationException(path, name, actual);
        }
        return extractor.apply(node);
    }

    @Override
    public String describe() {
        return name;
    }

    @Override
    public String toString() {
        return name;
    }
}
