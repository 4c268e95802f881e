package com.nodeflow.api;

import lombok.Getter;

/**
 * Immutable description used to create a port.
 *
 * Nodes declare their static ports with a list of these and may create more
 * at runtime with {@code createInput}/{@code createOutput}.
 */
@Getter
public final class PortConfig {
    /** Untyped data port without label or default. */
    public static final PortConfig DEFAULT = new PortConfig("", PortKind.DATA, null, null);

    private final String label;
    private final PortKind kind;
    private final DataType allowedData;
    private final Object defaultValue;

    public PortConfig(String label, PortKind kind, DataType allowedData, Object defaultValue) {
        this.label = label == null ? "" : label;
        this.kind = kind == null ? PortKind.DATA : kind;
        this.allowedData = allowedData;
        this.defaultValue = defaultValue;
    }

    public static PortConfig data(String label) {
        return new PortConfig(label, PortKind.DATA, null, null);
    }

    public static PortConfig data(String label, DataType allowedData) {
        return new PortConfig(label, PortKind.DATA, allowedData, null);
    }

    public static PortConfig data(String label, DataType allowedData, Object defaultValue) {
        return new PortConfig(label, PortKind.DATA, allowedData, defaultValue);
    }

    public static PortConfig exec(String label) {
        return new PortConfig(label, PortKind.EXEC, null, null);
    }
}
