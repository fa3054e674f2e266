package org.conclave.lifecycle;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Queue;
import java.util.Set;

/**
 * Computes the order in which services must be started so that every service starts after the
 * services it depends on. Uses Kahn's algorithm: in-degree counts plus a worklist of nodes
 * whose dependencies are all placed. Ties are broken by registration order.
 */
final class StartOrderResolver {

    private StartOrderResolver() {
        // static helper
    }

    /**
     * Resolves the start order.
     * <p>
     * Dependencies on names that are not part of {@code dependenciesByService} do not
     * constrain the order; starting such a service fails later because its dependency is
     * missing.
     *
     * @param dependenciesByService Declared dependencies per service, in registration order.
     * @return The complete start order, or empty if the graph contains a cycle.
     */
    static Optional<List<String>> resolve(Map<String, Set<String>> dependenciesByService) {
        Map<String, Integer> inDegree = new LinkedHashMap<>();
        Map<String, Set<String>> dependents = new LinkedHashMap<>();
        for (String service : dependenciesByService.keySet()) {
            inDegree.put(service, 0);
            dependents.put(service, new LinkedHashSet<>());
        }

        for (Map.Entry<String, Set<String>> entry : dependenciesByService.entrySet()) {
            for (String dependency : entry.getValue()) {
                if (dependents.containsKey(dependency) && dependents.get(dependency).add(entry.getKey())) {
                    inDegree.merge(entry.getKey(), 1, Integer::sum);
                }
            }
        }

        Queue<String> ready = new ArrayDeque<>();
        inDegree.forEach((service, degree) -> {
            if (degree == 0) {
                ready.add(service);
            }
        });

        List<String> order = new ArrayList<>(dependenciesByService.size());
        while (!ready.isEmpty()) {
            String current = ready.poll();
            order.add(current);
            for (String dependent : dependents.get(current)) {
                int remaining = inDegree.merge(dependent, -1, Integer::sum);
                if (remaining == 0) {
                    ready.add(dependent);
                }
            }
        }

        if (order.size() != dependenciesByService.size()) {
            return Optional.empty();
        }
        return Optional.of(order);
    }

    /**
     * Lists the services that cannot be placed because they sit on or behind a cycle.
     *
     * @param dependenciesByService Declared dependencies per service, in registration order.
     * @return The unplaceable services, empty if the graph is acyclic.
     */
    static List<String> unresolvable(Map<String, Set<String>> dependenciesByService) {
        Map<String, Set<String>> remaining = new LinkedHashMap<>(dependenciesByService);
        boolean progress = true;
        while (progress) {
            progress = false;
            for (Map.Entry<String, Set<String>> entry : new ArrayList<>(remaining.entrySet())) {
                boolean blocked = entry.getValue().stream().anyMatch(remaining::containsKey);
                if (!blocked) {
                    remaining.remove(entry.getKey());
                    progress = true;
                }
            }
        }
        return new ArrayList<>(remaining.keySet());
    }
}
