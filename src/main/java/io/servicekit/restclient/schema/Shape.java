package io.servicekit.restclient.schema;

import com.fasterxml.jackson.databind.JsonNode;
import io.servicekit.restclient.ValidationException;

import java.util.Objects;
import java.util.function.Function;

/**
 * Declarative description of an expected JSON value. A shape knows how to check a parsed node against itself and turn
 * it into a Java value; it never inspects classes reflectively.
 *
 * <p>Shapes are immutable and may be shared between threads and calls. Build them through {@link Shapes}.</p>
 *
 * @param <T> type of the bound value.
 */
public interface Shape<T> {

    /**
     * Binds {@code node} against this shape.
     *
     * @param node parsed value; a missing node denotes an absent value.
     * @param path location of {@code node} inside the document, used in error reports.
     * @return the bound value.
     * @throws ValidationException on the first structural mismatch.
     */
    T bind(JsonNode node, String path) throws ValidationException;

    /**
     * @return short description of the expected value used in validation errors, for example {@code integer}.
     */
    String describe();

    /**
     * @return {@code false} when the shape ignores the response body, so it need not be parsed at all.
     */
    default boolean readsBody() {
        return true;
    }

    /**
     * Returns a shape that binds like this one and then converts the result, typically into a record.
     */
    default <R> Shape<R> map(Function<? super T, ? extends R> mapper) {
        Objects.requireNonNull(mapper, "mapper");
        Shape<T> source = this;
        return new Shape<>() {
            @Override
            public R bind(JsonNode node, String path) throws ValidationException {
                T value = source.bind(node, path);
                return value == null ? null : mapper.apply(value);
            }

            @Override
            public String describe() {
                return source.describe();
            }

            @Override
            public boolean readsBody() {
                return source.readsBody();
            }
        };
    }
}
