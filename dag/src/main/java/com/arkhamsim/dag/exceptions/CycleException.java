package com.arkhamsim.dag.exceptions;

/** Thrown when an edge would close a directed cycle in a partial order. The graph is left unchanged. */
public final class CycleException extends RuntimeException {
    private final Object tail;
    private final Object head;

    public CycleException(Object tail, Object head) {
        super("Adding edge " + tail + " -> " + head + " creates a cycle, which is not allowed in a partial order");
        this.tail = tail;
        this.head = head;
    }

    public Object tail() { return tail; }

    public Object head() { return head; }
}
