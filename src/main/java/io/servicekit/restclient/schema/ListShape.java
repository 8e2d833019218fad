package io.servicekit.restclient.schema;

import com.fasterxml.jackson.databind.JsonNode;
import io.servicekit.restclient.ValidationException;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * Homogeneous JSON array whose elements all match one element shape.
 *
 * @param <E> bound element type.
 */
public final class ListShape<E> implements Shape<List<E>> {

    private final Shape<E> element;

    ListShape(Shape<E> element) {
        this.element = Objects.requireNonNull(element, "element");
    }

    public Shape<E> element() {
        return element;
    }

    @Override
    public List<E> bind(JsonNode node, String path) throws ValidationException {
        if (node == null || !node.isArray()) {
            throw new ValidationException(path, describe(), Paths.typeOf(node));
        }
        List<E> values = new ArrayList<>(node.size());
        for (int i = 0; i < node.size(); i++) {
            values.add(element.bind(node.get(i), Paths.index(path, i)));
        }
        return Collections.unmodifiableList(values);
    }

    @Override
    public String describe() {
        return "array";
    }

    @Override
    public String toString() {
        return "list<" + element + ">";
    }
}
