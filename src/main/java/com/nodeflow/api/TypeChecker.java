package com.nodeflow.api;

/**
 * Capability that decides data type compatibility for a flow.
 *
 * Evaluated at connect time ({@link #canConnect}) and whenever a node sets an
 * output value ({@link #accepts}). A null {@link DataType} means "anything".
 */
public interface TypeChecker {

    /**
     * @param out declared type of the output port, may be null
     * @param in  declared type of the input port, may be null
     * @return true if every value the output may carry is acceptable to the
     *         input
     */
    boolean canConnect(DataType out, DataType in);

    /**
     * @param declared declared type of the port, may be null
     * @param value    value about to be stored, may be null
     * @return true if the value conforms to the declared type
     */
    boolean accepts(DataType declared, Object value);
}
