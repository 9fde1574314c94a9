package com.company.reliability.repository;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.HashMap;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Dependency graph built from declared edges. Traversal is breadth first so
 * each upstream service is reported at its shortest depth; cycles are safe.
 */
public class InMemoryDependencyGraph implements DependencyGraph {

    private final Map<String, Set<String>> upstreamByService = new HashMap<>();

    public InMemoryDependencyGraph addDependency(String service, String upstream) {
        upstreamByService.computeIfAbsent(service, key -> new LinkedHashSet<>()).add(upstream);
        return this;
    }

    @Override
    public List<String> getUpstream(String service) {
        return new ArrayList<>(upstreamByService.getOrDefault(service, Set.of()));
    }

    @Override
    public List<DependencyEdge> getTransitiveUpstream(String service) {
        Map<String, DependencyEdge> found = new LinkedHashMap<>();
        Set<String> visited = new HashSet<>();
        visited.add(service);

        Deque<DependencyEdge> queue = new ArrayDeque<>();
        for (String upstream : getUpstream(service)) {
            queue.add(new DependencyEdge(upstream, service, 1));
        }

        while (!queue.isEmpty()) {
            DependencyEdge edge = queue.poll();
            if (!visited.add(edge.getUpstream())) {
                continue;
            }
            found.put(edge.getUpstream(), edge);
            for (String next : getUpstream(edge.getUpstream())) {
                if (!visited.contains(next)) {
                    queue.add(new DependencyEdge(next, edge.getUpstream(), edge.getDepth() + 1));
                }
            }
        }
        return new ArrayList<>(found.values());
    }
}
