package com.arkhamsim.dag;

import com.arkhamsim.common.errorsor.ErrorsOr;

import java.util.*;

public final class PartialOrderBuilder {
    private PartialOrderBuilder() {}

    /**
     * Builds a partial order from the given nodes and edges, inserting edges in iteration order.
     * Every edge that would close a cycle is reported; a single bad edge does not stop the rest.
     * Never throws for cycles.
     */
    public static <N> ErrorsOr<PartialOrder<N>> build(Collection<N> nodes, Collection<Edge<N>> edges) {
        Objects.requireNonNull(nodes);
        Objects.requireNonNull(edges);

        PartialOrder<N> order = new PartialOrder<>();
        for (N n : nodes) order.addNode(n);

        List<String> errors = new ArrayList<>();
        for (Edge<N> e : edges) {
            order.tryAddEdge(e.tail(), e.head()).ifError(errors::addAll);
        }
        return errors.isEmpty() ? ErrorsOr.lift(order) : ErrorsOr.errors(errors);
    }
}
