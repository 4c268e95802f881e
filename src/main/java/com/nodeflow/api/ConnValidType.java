package com.nodeflow.api;

/**
 * Result of a connect or disconnect request.
 *
 * Connection requests never throw for an invalid pair of ports; callers
 * (editors, tests, the loader) inspect this code instead.
 */
public enum ConnValidType {
    /** The request is legal. */
    VALID,
    /** Both ports belong to the same node. */
    SAME_NODE,
    /** Both ports are inputs, or both are outputs. */
    SAME_IO,
    /** The "output" argument is an input and vice versa. */
    IO_MISMATCH,
    /** A data port and an exec port. */
    DIFF_ALG_TYPE,
    /** The input's declared type does not accept the output's declared type. */
    DATA_MISMATCH,
    /** The input already has an incoming connection. */
    INPUT_TAKEN,
    /** The two ports are already connected. */
    ALREADY_CONNECTED,
    /** The two ports are not connected. */
    ALREADY_DISCONNECTED;

    public boolean isValid() {
        return this == VALID;
    }
}
