package com.nodeflow.engine;

import com.nodeflow.api.DataType;
import com.nodeflow.api.TypeChecker;

import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Default {@link TypeChecker}: resolves type tags by name and decides
 * compatibility by Java class assignability.
 *
 * Rules:
 * - an untyped input accepts any output;
 * - an untyped output only fits an input declared as {@link #OBJECT};
 * - otherwise the input's class must be assignable from the output's class.
 */
public final class TypeRegistry implements TypeChecker {
    public static final DataType OBJECT = DataType.named("object", Object.class);
    public static final DataType NUMBER = DataType.named("number", Number.class);
    public static final DataType INTEGER = DataType.named("integer", Integer.class);
    public static final DataType LONG = DataType.named("long", Long.class);
    public static final DataType DOUBLE = DataType.named("double", Double.class);
    public static final DataType STRING = DataType.named("string", String.class);
    public static final DataType BOOLEAN = DataType.named("boolean", Boolean.class);
    public static final DataType LIST = DataType.named("list", List.class);
    public static final DataType MAP = DataType.named("map", Map.class);

    /** Name under which an untyped port is exported. */
    public static final String ANY = "any";

    private final Map<String, DataType> byName = new ConcurrentHashMap<>();

    public TypeRegistry() {
        for (DataType t : List.of(OBJECT, NUMBER, INTEGER, LONG, DOUBLE, STRING, BOOLEAN, LIST, MAP))
            register(t);
    }

    /**
     * Registers a tag. Re-registering an equal tag is a no-op.
     *
     * @throws IllegalArgumentException if another tag already uses the name
     */
    public TypeRegistry register(DataType type) {
        DataType prev = byName.putIfAbsent(type.name(), type);
        if (prev != null && !prev.equals(type))
            throw new IllegalArgumentException("Type name already registered: " + type.name());
        return this;
    }

    /**
     * Resolves a tag name. {@code null} and {@value #ANY} resolve to null
     * (untyped).
     *
     * @throws IllegalArgumentException for unknown names
     */
    public DataType resolve(String name) {
        if (name == null || ANY.equals(name))
            return null;
        DataType t = byName.get(name);
        if (t == null)
            throw new IllegalArgumentException("Unknown data type: " + name);
        return t;
    }

    /** Export name of a possibly null tag. */
    public static String nameOf(DataType type) {
        return type == null ? ANY : type.name();
    }

    @Override
    public boolean canConnect(DataType out, DataType in) {
        if (in == null)
            return true;
        if (out == null)
            return in.javaType() == Object.class;
        return in.javaType().isAssignableFrom(out.javaType());
    }

    @Override
    public boolean accepts(DataType declared, Object value) {
        return declared == null || value == null || declared.javaType().isInstance(value);
    }
}
