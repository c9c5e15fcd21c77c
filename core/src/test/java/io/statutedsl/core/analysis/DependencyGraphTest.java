package io.statutedsl.core.analysis;

import static org.assertj.core.api.Assertions.assertThat;

import java.util.List;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

@DisplayName("DependencyGraph")
class DependencyGraphTest {

    @Test
    @DisplayName("acyclic graph → no cycles")
    void acyclic() {
        DependencyGraph graph = new DependencyGraph();
        graph.addEdge("a", "b");
        graph.addEdge("b", "c");
        graph.addEdge("a", "c");

        assertThat(graph.findCycles()).isEmpty();
        assertThat(graph.nodes()).containsExactly("a", "b", "c");
        assertThat(graph.successors("a")).containsExactly("b", "c");
        assertThat(graph.successors("unknown")).isEmpty();
    }

    @Test
    @DisplayName("two-node cycle is reported once")
    void twoCycle() {
        DependencyGraph graph = new DependencyGraph();
        graph.addEdge("a", "b");
        graph.addEdge("b", "a");

        assertThat(graph.findCycles()).containsExactly(List.of("a", "b"));
    }

    @Test
    @DisplayName("cycle path starts where the search entered it")
    void entryPoint() {
        DependencyGraph graph = new DependencyGraph();
        graph.addNode("root");
        graph.addEdge("root", "x");
        graph.addEdge("x", "y");
        graph.addEdge("y", "z");
        graph.addEdge("z", "x");

        assertThat(graph.findCycles()).containsExactly(List.of("x", "y", "z"));
    }

    @Test
    @DisplayName("disjoint cycles are each reported")
    void disjoint() {
        DependencyGraph graph = new DependencyGraph();
        graph.addEdge("a", "b");
        graph.addEdge("b", "a");
        graph.addEdge("c", "d");
        graph.addEdge("d", "c");

        assertThat(graph.findCycles()).containsExactly(List.of("a", "b"), List.of("c", "d"));
    }

    @Test
    @DisplayName("self-edges are dropped")
    void selfEdge() {
        DependencyGraph graph = new DependencyGraph();
        graph.addEdge("a", "a");

        assertThat(graph.nodes()).containsExactly("a");
        assertThat(graph.successors("a")).isEmpty();
        assertThat(graph.findCycles()).isEmpty();
    }
}
