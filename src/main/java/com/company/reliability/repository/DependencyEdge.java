package com.company.reliability.repository;

import lombok.AllArgsConstructor;
import lombok.Value;

/**
 * {@code upstream} is called by {@code downstream}; depth is 1 for a direct
 * edge.
 */
@Value
@AllArgsConstructor
public class DependencyEdge {
    String upstream;
    String downstream;
    int depth;
}
