package com.company.reliability.repository;

import java.util.List;

public interface DependencyGraph {

    /**
     * Services {@code service} calls directly.
     */
    List<String> getUpstream(String service);

    /**
     * Every service reachable through upstream edges, each with its shortest
     * depth from {@code service}.
     */
    List<DependencyEdge> getTransitiveUpstream(String service);
}
