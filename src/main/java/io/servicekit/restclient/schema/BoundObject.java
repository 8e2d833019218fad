package io.servicekit.restclient.schema;

import java.math.BigDecimal;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Values of a JSON object bound against an {@link ObjectShape}. Only declared fields are present; an optional field
 * that was absent holds its declared default.
 */
public final class BoundObject {

    private final Map<String, Object> values;

    BoundObject(Map<String, Object> values) {
        this.values = Collections.unmodifiableMap(new LinkedHashMap<>(values));
    }

    public boolean has(String name) {
        return values.containsKey(name);
    }

    public Object get(String name) {
        if (!values.containsKey(name)) {
            throw new IllegalArgumentException("field " + name + " is not declared by the shape");
        }
        return values.get(name);
    }

    public <T> T get(String name, Class<T> type) {
        Objects.requireNonNull(type, "type");
        Object value = get(name);
        if (value != null && !type.isInstance(value)) {
            throw new ClassCastException("field " + name + " holds " + value.getClass().getSimpleName()
                + ", not " + type.getSimpleName());
        }
        return type.cast(value);
    }

    public String getString(String name) {
        return get(name, String.class);
    }

    public Long getLong(String name) {
        return get(name, Long.class);
    }

    public Integer getInt(String name) {
        Long value = getLong(name);
        return value == null ? null : Math.toIntExact(value);
    }

    public Double getDouble(String name) {
        return get(name, Double.class);
    }

    public BigDecimal getDecimal(String name) {
        return get(name, BigDecimal.class);
    }

    public Boolean getBoolean(String name) {
        return get(name, Boolean.class);
    }

    public BoundObject getObject(String name) {
        return get(name, BoundObject.class);
    }

    @SuppressWarnings("unchecked")
    public <E> List<E> getList(String name) {
        return (List<E>) get(name, List.class);
    }

    public Map<String, Object> asMap() {
        return values;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof BoundObject)) {
            return false;
        }
        return values.equals(((BoundObject) o).values);
    }

    @Override
    public int hashCode() {
        return values.hashCode();
    }

    @Override
    public String toString() {
        return values.toString();
    }
}
