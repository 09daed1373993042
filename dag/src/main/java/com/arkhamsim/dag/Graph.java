package com.arkhamsim.dag;

import java.util.Set;

/**
 * A mutable directed graph that only grows: nodes and edges can be added, never removed.
 * <p>
 * Nodes are compared with {@code equals}/{@code hashCode}, so the node type must keep both stable
 * for as long as it sits in a graph. Null nodes are rejected.
 *
 * @param <N> node type
 */
public interface Graph<N> {

    /** Read-only, live view of the node set, in insertion order. */
    Set<N> nodes();

    /** Read-only, live view of the edge set, in insertion order. */
    Set<Edge<N>> edges();

    /** Heads of the edges leaving {@code node}; empty if the node is unknown. */
    Set<N> successors(N node);

    /** Adds {@code node} if absent. Idempotent. */
    void addNode(N node);

    /** Adds the edge tail→head, adding either endpoint that is not yet a node. Idempotent. */
    void addEdge(N tail, N head);

    default boolean containsNode(N node) {
        return nodes().contains(node);
    }

    default boolean containsEdge(N tail, N head) {
        return edges().contains(new Edge<>(tail, head));
    }

    default GraphSnapshot<N> snapshot() {
        return new GraphSnapshot<>(nodes(), edges());
    }
}
