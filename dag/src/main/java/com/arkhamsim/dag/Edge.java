package com.arkhamsim.dag;

import java.util.Objects;

/** Directed edge tail→head. */
public record Edge<N>(N tail, N head) {
    public Edge {
        Objects.requireNonNull(tail, "tail");
        Objects.requireNonNull(head, "head");
    }

    public boolean isSelfLoop() {
        return tail.equals(head);
    }

    @Override
    public String toString() {
        return "(" + tail + " -> " + head + ")";
    }
}
