package org.conclave.lifecycle;

import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

import static org.assertj.core.api.Assertions.assertThat;

@Tag("unit")
class StartOrderResolverTest {

    @Test
    void ordersDependenciesBeforeDependents() {
        Map<String, Set<String>> graph = new LinkedHashMap<>();
        graph.put("c", Set.of("b"));
        graph.put("b", Set.of("a"));
        graph.put("a", Set.of());

        assertThat(StartOrderResolver.resolve(graph)).contains(List.of("a", "b", "c"));
    }

    @Test
    void keepsRegistrationOrderAmongIndependentServices() {
        Map<String, Set<String>> graph = new LinkedHashMap<>();
        graph.put("metrics", Set.of());
        graph.put("store", Set.of());
        graph.put("api", Set.of("store"));
        graph.put("cache", Set.of());

        assertThat(StartOrderResolver.resolve(graph)).contains(List.of("metrics", "store", "cache", "api"));
    }

    @Test
    void unknownDependenciesDoNotBlockOrdering() {
        Map<String, Set<String>> graph = new LinkedHashMap<>();
        graph.put("worker", Set.of("missing"));

        assertThat(StartOrderResolver.resolve(graph)).contains(List.of("worker"));
    }

    @Test
    void cycleYieldsNoOrder() {
        Map<String, Set<String>> graph = new LinkedHashMap<>();
        graph.put("free", Set.of());
        graph.put("a", Set.of("b"));
        graph.put("b", Set.of("a"));
        graph.put("behind", Set.of("a"));

        assertThat(StartOrderResolver.resolve(graph)).isEmpty();
        assertThat(StartOrderResolver.unresolvable(graph)).containsExactly("a", "b", "behind");
    }
}
