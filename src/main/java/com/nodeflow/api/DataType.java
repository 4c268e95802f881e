package com.nodeflow.api;

import java.util.Objects;

/**
 * Declared type tag of a data port.
 *
 * A tag pairs a stable name (used by the JSON export) with the Java class that
 * values on the port are expected to be instances of. Whether two tags are
 * compatible is not decided here but by the {@link TypeChecker} injected into
 * the flow.
 *
 * A port declaring no type (null) accepts anything.
 */
public final class DataType {
    private final String name;
    private final Class<?> javaType;

    private DataType(String name, Class<?> javaType) {
        this.name = Objects.requireNonNull(name, "name");
        this.javaType = Objects.requireNonNull(javaType, "javaType");
    }

    /** Creates a tag named after the class' simple name. */
    public static DataType of(Class<?> javaType) {
        return new DataType(javaType.getSimpleName().toLowerCase(), javaType);
    }

    public static DataType named(String name, Class<?> javaType) {
        return new DataType(name, javaType);
    }

    public String name() {
        return name;
    }

    public Class<?> javaType() {
        return javaType;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o)
            return true;
        if (!(o instanceof DataType other))
            return false;
        return name.equals(other.name) && javaType.equals(other.javaType);
    }

    @Override
    public int hashCode() {
        return Objects.hash(name, javaType);
    }

    @Override
    public String toString() {
        return name;
    }
}
