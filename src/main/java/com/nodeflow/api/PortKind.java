package com.nodeflow.api;

/**
 * The algorithmic kind of a port.
 *
 * DATA ports carry values, EXEC ports carry trigger signals only. A connection
 * may only join two ports of the same kind.
 */
public enum PortKind {
    DATA,
    EXEC
}
