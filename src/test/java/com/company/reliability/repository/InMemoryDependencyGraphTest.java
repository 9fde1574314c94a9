package com.company.reliability.repository;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

@DisplayName("InMemoryDependencyGraph")
class InMemoryDependencyGraphTest {

    @Test
    @DisplayName("Should report each upstream service at its shortest depth")
    void shouldReportShortestDepth() {
        InMemoryDependencyGraph graph = new InMemoryDependencyGraph()
                .addDependency("checkout", "payments")
                .addDependency("checkout", "ledger")
                .addDependency("payments", "ledger")
                .addDependency("ledger", "postgres");

        List<DependencyEdge> edges = graph.getTransitiveUpstream("checkout");

        assertThat(edges).extracting(DependencyEdge::getUpstream)
                .containsExactlyInAnyOrder("payments", "ledger", "postgres");
        assertThat(edges).filteredOn(edge -> "ledger".equals(edge.getUpstream()))
                .extracting(DependencyEdge::getDepth).containsExactly(1);
        assertThat(edges).filteredOn(edge -> "postgres".equals(edge.getUpstream()))
                .extracting(DependencyEdge::getDepth).containsExactly(2);
    }

    @Test
    @DisplayName("Should terminate on cycles")
    void shouldTerminateOnCycles() {
        InMemoryDependencyGraph graph = new InMemoryDependencyGraph()
                .addDependency("a", "b")
                .addDependency("b", "a");

        assertThat(graph.getTransitiveUpstream("a")).extracting(DependencyEdge::getUpstream).containsExactly("b");
        assertThat(graph.getUpstream("unknown")).isEmpty();
    }
}
