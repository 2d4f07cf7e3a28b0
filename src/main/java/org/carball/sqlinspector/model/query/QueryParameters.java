package org.carball.sqlinspector.model.query;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;
import lombok.EqualsAndHashCode;
import lombok.ToString;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Values bound to a statement. Depending on the driver they are either
 * positional ({@code ?} placeholders) or named ({@code :name} placeholders).
 * Null values are allowed and stand for SQL {@code NULL}.
 */
@EqualsAndHashCode
@ToString
public final class QueryParameters {

    private static final QueryParameters NONE = new QueryParameters(Collections.emptyList(), null);

    private final List<Object> positional;
    private final Map<String, Object> named;

    private QueryParameters(List<Object> positional, Map<String, Object> named) {
        this.positional = positional;
        this.named = named;
    }

    public static QueryParameters none() {
        return NONE;
    }

    public static QueryParameters positional(List<?> values) {
        if (values == null || values.isEmpty()) {
            return NONE;
        }
        return new QueryParameters(Collections.unmodifiableList(new ArrayList<>(values)), null);
    }

    public static QueryParameters positional(Object... values) {
        return positional(values == null ? null : java.util.Arrays.asList(values));
    }

    public static QueryParameters named(Map<String, ?> values) {
        if (values == null) {
            return NONE;
        }
        return new QueryParameters(null, Collections.unmodifiableMap(new LinkedHashMap<>(values)));
    }

    /**
     * Builds parameters from their JSON shape: an array is positional, an object is named.
     */
    @JsonCreator
    @SuppressWarnings("unchecked")
    public static QueryParameters fromJson(Object value) {
        if (value == null) {
            return NONE;
        }
        if (value instanceof Map) {
            return named((Map<String, ?>) value);
        }
        if (value instanceof List) {
            return positional((List<?>) value);
        }
        throw new IllegalArgumentException("Parameters must be an array or an object, got " + value.getClass().getSimpleName());
    }

    public boolean isNamed() {
        return named != null;
    }

    public boolean isEmpty() {
        return isNamed() ? named.isEmpty() : positional.isEmpty();
    }

    public int size() {
        return isNamed() ? named.size() : positional.size();
    }

    /**
     * Positional values, or an empty list for named parameters.
     */
    public List<Object> getPositional() {
        return isNamed() ? Collections.emptyList() : positional;
    }

    /**
     * Named values in binding order, or an empty map for positional parameters.
     */
    public Map<String, Object> getNamed() {
        return isNamed() ? named : Collections.emptyMap();
    }

    public Collection<Object> values() {
        return isNamed() ? named.values() : positional;
    }

    @JsonValue
    public Object toJson() {
        return isNamed() ? named : positional;
    }
}
