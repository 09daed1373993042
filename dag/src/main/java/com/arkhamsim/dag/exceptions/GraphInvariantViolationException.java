package com.arkhamsim.dag.exceptions;

/**
 * The cycle search met a node that is already on its own search path, so the graph holds a cycle
 * it should never have accepted. Indicates corrupted structure, not bad input.
 */
public final class GraphInvariantViolationException extends IllegalStateException {
    public GraphInvariantViolationException(String message) { super(message); }
}
