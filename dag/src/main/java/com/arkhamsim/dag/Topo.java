package com.arkhamsim.dag;

import java.util.*;

public final class Topo {
    private Topo() {}

    /**
     * Kahn’s algorithm, emitting one set per generation: sources first, then the nodes whose
     * predecessors all sit in earlier generations.
     *
     * @throws IllegalStateException if the graph contains a cycle
     */
    public static <N> List<Set<N>> topoSort(Graph<N> graph) {
        Map<N, Integer> indeg = new LinkedHashMap<>();
        for (N n : graph.nodes()) indeg.put(n, 0);
        for (Edge<N> e : graph.edges()) indeg.merge(e.head(), 1, Integer::sum);

        Set<N> gen = new LinkedHashSet<>();
        for (var en : indeg.entrySet()) if (en.getValue() == 0) gen.add(en.getKey());

        List<Set<N>> gens = new ArrayList<>();
        int placed = 0;

        while (!gen.isEmpty()) {
            gens.add(Collections.unmodifiableSet(gen));
            placed += gen.size();
            Set<N> next = new LinkedHashSet<>();
            for (N n : gen) {
                for (N m : graph.successors(n)) {
                    if (indeg.merge(m, -1, Integer::sum) == 0) next.add(m);
                }
            }
            gen = next;
        }

        if (placed != indeg.size()) {
            Set<N> stuck = new LinkedHashSet<>();
            for (var en : indeg.entrySet()) if (en.getValue() > 0) stuck.add(en.getKey());
            throw new IllegalStateException("Cycle detected among nodes: " + stuck);
        }
        return gens;
    }
}
