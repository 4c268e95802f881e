package com.nodeflow.api;

/**
 * Algorithm mode of a flow. One-to-one with an executor type.
 */
public enum FlowAlg {
    MANUAL("manual"),
    DATA("data"),
    DATA_OPT("data opt"),
    EXEC("exec");

    private final String label;

    FlowAlg(String label) {
        this.label = label;
    }

    /** The string form used by the JSON export and the control surface. */
    public String label() {
        return label;
    }

    /**
     * Parses a mode string. Accepts the labels, the enum names and
     * {@code data-opt}, case-insensitively.
     *
     * @throws IllegalArgumentException for unknown modes
     */
    public static FlowAlg fromString(String s) {
        if (s == null)
            throw new IllegalArgumentException("Algorithm mode must not be null");
        String norm = s.trim().toLowerCase().replace('-', ' ').replace('_', ' ');
        for (FlowAlg alg : values()) {
            if (alg.label.equals(norm))
                return alg;
        }
        throw new IllegalArgumentException("Unknown algorithm mode: " + s);
    }

    @Override
    public String toString() {
        return label;
    }
}
