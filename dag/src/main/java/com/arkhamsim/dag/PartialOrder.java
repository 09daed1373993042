package com.arkhamsim.dag;

import com.arkhamsim.common.errorsor.ErrorsOr;
import com.arkhamsim.dag.exceptions.CycleException;
import com.arkhamsim.dag.exceptions.GraphInvariantViolationException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.*;

/**
 * A directed acyclic graph. Wraps a {@link DirectedGraph} and refuses any edge that would close a cycle,
 * self-loops included. A refused edge leaves the graph exactly as it was.
 * <p>
 * The order relation is reachability: {@code a <= b} iff {@link #reaches(Object, Object) reaches(a, b)}.
 */
public final class PartialOrder<N> implements Graph<N> {
    private static final Logger LOG = LoggerFactory.getLogger(PartialOrder.class);

    private final DirectedGraph<N> graph;

    public PartialOrder() {
        this(new DirectedGraph<>());
    }

    /** Wraps an existing graph without checking it. Tests use this to hand in a corrupted graph. */
    PartialOrder(DirectedGraph<N> graph) {
        this.graph = Objects.requireNonNull(graph, "graph");
    }

    @Override
    public Set<N> nodes() {
        return graph.nodes();
    }

    @Override
    public Set<Edge<N>> edges() {
        return graph.edges();
    }

    @Override
    public Set<N> successors(N node) {
        return graph.successors(node);
    }

    @Override
    public void addNode(N node) {
        graph.addNode(node);
    }

    /**
     * Adds tail→head unless head already reaches tail.
     *
     * @throws CycleException                   if the edge would close a cycle (including tail == head)
     * @throws GraphInvariantViolationException if the existing edges already contain a cycle
     */
    @Override
    public void addEdge(N tail, N head) {
        Objects.requireNonNull(tail, "tail");
        Objects.requireNonNull(head, "head");
        if (reaches(head, tail)) {
            LOG.debug("Rejected edge {} -> {}: {} already reaches {}", tail, head, head, tail);
            throw new CycleException(tail, head);
        }
        graph.addEdge(tail, head);
    }

    /** Like {@link #addEdge} but reports a cycle as an error value instead of throwing. */
    public ErrorsOr<Edge<N>> tryAddEdge(N tail, N head) {
        try {
            addEdge(tail, head);
            return ErrorsOr.lift(new Edge<>(tail, head));
        } catch (CycleException e) {
            return ErrorsOr.error(e.getMessage());
        }
    }

    /**
     * True iff {@code to} can be reached from {@code from} by following zero or more edges.
     * Every node reaches itself. Cost is O(V + E).
     */
    public boolean reaches(N from, N to) {
        if (from.equals(to)) return true;

        Set<N> onPath = new HashSet<>();
        Set<N> finished = new HashSet<>();
        Deque<N> path = new ArrayDeque<>();
        Deque<Iterator<N>> pending = new ArrayDeque<>();

        onPath.add(from);
        path.push(from);
        pending.push(graph.successors(from).iterator());

        while (!pending.isEmpty()) {
            Iterator<N> it = pending.peek();
            if (!it.hasNext()) {
                pending.pop();
                N done = path.pop();
                onPath.remove(done);
                finished.add(done);
                continue;
            }
            N next = it.next();
            if (next.equals(to)) return true;
            if (onPath.contains(next)) {
                List<N> cycle = new ArrayList<>(path);
                Collections.reverse(cycle);
                LOG.error("Partial order already contains a cycle through {} (search path {})", next, cycle);
                throw new GraphInvariantViolationException(
                        next + " is already on the search path " + cycle + "; the partial order contains a cycle");
            }
            if (finished.contains(next)) continue;
            onPath.add(next);
            path.push(next);
            pending.push(graph.successors(next).iterator());
        }
        return false;
    }

    /** Nodes grouped into generations: every edge goes from an earlier generation to a later one. */
    public List<Set<N>> topologicalGenerations() {
        return Topo.topoSort(this);
    }

    @Override
    public String toString() {
        return "PartialOrder(nodes=" + graph.nodes().size() + ", edges=" + graph.edges().size() + ")";
    }
}
