package org.carball.sqlinspector.token;

import java.math.BigDecimal;
import java.math.BigInteger;
import java.util.Optional;
import java.util.function.Function;

/**
 * Scalar parameter types a query token can carry. Each value travels as its
 * type name plus its {@code toString()} form, so it is read back as the same
 * Java type with the same value and scale.
 */
enum ParameterType {

    NULL(null, text -> null),
    STRING(String.class, text -> text),
    BOOLEAN(Boolean.class, Boolean::valueOf),
    BYTE(Byte.class, Byte::valueOf),
    SHORT(Short.class, Short::valueOf),
    INTEGER(Integer.class, Integer::valueOf),
    LONG(Long.class, Long::valueOf),
    FLOAT(Float.class, Float::valueOf),
    DOUBLE(Double.class, Double::valueOf),
    BIG_INTEGER(BigInteger.class, BigInteger::new),
    BIG_DECIMAL(BigDecimal.class, BigDecimal::new);

    private final Class<?> javaType;
    private final Function<String, Object> parser;

    ParameterType(Class<?> javaType, Function<String, Object> parser) {
        this.javaType = javaType;
        this.parser = parser;
    }

    /**
     * The type of a parameter value, or empty when tokens cannot carry it.
     */
    static Optional<ParameterType> of(Object value) {
        if (value == null) {
            return Optional.of(NULL);
        }
        for (ParameterType type : values()) {
            if (type.javaType == value.getClass()) {
                return Optional.of(type);
            }
        }
        return Optional.empty();
    }

    String encode(Object value) {
        return value == null ? null : value.toString();
    }

    /**
     * @throws IllegalArgumentException if the text is not a valid value of this type
     */
    Object decode(String text) {
        if (this != NULL && text == null) {
            throw new IllegalArgumentException(name() + " parameter has no value");
        }
        return parser.apply(text);
    }
}
