package com.arkhamsim.dag;

import java.util.*;

/**
 * Plain directed graph. Accepts any edge, including self-loops and edges that close a cycle;
 * use {@link PartialOrder} when acyclicity matters.
 * <p>
 * Single-threaded: callers sharing an instance across threads must guard it themselves.
 */
public final class DirectedGraph<N> implements Graph<N> {
    private final Set<N> nodes = new LinkedHashSet<>();
    private final Set<Edge<N>> edges = new LinkedHashSet<>();
    // tail -> heads, kept in step with edges
    private final Map<N, Set<N>> successors = new LinkedHashMap<>();

    private final Set<N> nodesView = Collections.unmodifiableSet(nodes);
    private final Set<Edge<N>> edgesView = Collections.unmodifiableSet(edges);

    @Override
    public Set<N> nodes() {
        return nodesView;
    }

    @Override
    public Set<Edge<N>> edges() {
        return edgesView;
    }

    @Override
    public Set<N> successors(N node) {
        Set<N> heads = successors.get(node);
        return heads == null ? Set.of() : Collections.unmodifiableSet(heads);
    }

    @Override
    public void addNode(N node) {
        Objects.requireNonNull(node, "node");
        if (nodes.add(node)) {
            successors.put(node, new LinkedHashSet<>());
        }
    }

    @Override
    public void addEdge(N tail, N head) {
        Edge<N> edge = new Edge<>(tail, head);
        addNode(tail);
        addNode(head);
        if (edges.add(edge)) {
            successors.get(tail).add(head);
        }
    }

    @Override
    public String toString() {
        return "DirectedGraph(nodes=" + nodes.size() + ", edges=" + edges.size() + ")";
    }
}
