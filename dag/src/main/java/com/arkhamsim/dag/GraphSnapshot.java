package com.arkhamsim.dag;

import java.util.*;

/** Immutable copy of a graph's nodes + (tail→head) edges. */
public record GraphSnapshot<N>(Set<N> nodes, Set<Edge<N>> edges) {
  public GraphSnapshot {
    nodes = Collections.unmodifiableSet(new LinkedHashSet<>(nodes));
    edges = Collections.unmodifiableSet(new LinkedHashSet<>(edges));
  }
}
