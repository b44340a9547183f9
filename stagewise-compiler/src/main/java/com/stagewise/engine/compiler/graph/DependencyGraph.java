package com.stagewise.engine.compiler.graph;

import com.stagewise.engine.compiler.expression.PathRef;
import com.stagewise.engine.compiler.model.ExperimentNode;
import it.unimi.dsi.fastutil.objects.Object2IntMap;
import it.unimi.dsi.fastutil.objects.Object2IntOpenHashMap;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.Comparator;
import java.util.Deque;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.PriorityQueue;
import java.util.Set;
import java.util.logging.Logger;

/**
 * Read-only index of data dependencies between units.
 *
 * <p>An edge {@code X -> Y} means the visibility rule of {@code Y} reads data
 * submitted for {@code X}. References are taken from the compiled expression
 * paths: {@code X.field} and {@code responses.X.field} (or {@code session.X...})
 * both name unit {@code X}; other context namespaces never create edges.
 *
 * <p>Built once per compiled definition; immutable and thread-safe.
 */
public final class DependencyGraph {

    private static final Logger logger = Logger.getLogger(DependencyGraph.class.getName());

    private static final Set<String> RESPONSE_NAMESPACES = Set.of("session", "responses");
    private static final Set<String> NON_UNIT_NAMESPACES = Set.of(
            "participant", "scores", "assignments", "url_params", "url", "environment", "global");

    private final Map<String, Set<String>> dependents;
    private final Map<String, Set<String>> dependencies;
    private final Object2IntMap<String> definitionOrder;
    private final int edgeCount;

    private DependencyGraph(Map<String, Set<String>> dependents, Map<String, Set<String>> dependencies,
                            Object2IntMap<String> definitionOrder, int edgeCount) {
        this.dependents = dependents;
        this.dependencies = dependencies;
        this.definitionOrder = definitionOrder;
        this.edgeCount = edgeCount;
    }

    /**
     * Builds the graph over {@code nodes}, which must be in definition order.
     */
    public static DependencyGraph build(Collection<ExperimentNode> nodes) {
        Object2IntMap<String> order = new Object2IntOpenHashMap<>();
        order.defaultReturnValue(Integer.MAX_VALUE);
        for (ExperimentNode node : nodes) {
            order.put(node.id(), node.definitionOrder());
        }

        Map<String, Set<String>> forward = new LinkedHashMap<>();
        Map<String, Set<String>> reverse = new LinkedHashMap<>();
        int edges = 0;
        for (ExperimentNode node : nodes) {
            if (node.visibility() == null) {
                continue;
            }
            for (PathRef path : node.visibility().paths()) {
                String referenced = referencedUnit(path);
                if (referenced == null || !order.containsKey(referenced) || referenced.equals(node.id())) {
                    continue;
                }
                if (forward.computeIfAbsent(referenced, k -> new LinkedHashSet<>()).add(node.id())) {
                    reverse.computeIfAbsent(node.id(), k -> new LinkedHashSet<>()).add(referenced);
                    edges++;
                }
            }
        }
        return new DependencyGraph(freeze(forward), freeze(reverse), order, edges);
    }

    /**
     * Unit id named by a path, or {@code null} if the path points into a
     * non-unit namespace.
     */
    static String referencedUnit(PathRef path) {
        List<String> segments = path.segments();
        if (segments.size() < 2) {
            return null;
        }
        String head = segments.get(0).toLowerCase(Locale.ROOT);
        if (RESPONSE_NAMESPACES.contains(head)) {
            return segments.get(1);
        }
        if (NON_UNIT_NAMESPACES.contains(head)) {
            return null;
        }
        return segments.get(0);
    }

    /**
     * Units whose visibility reads {@code unitId} directly.
     */
    public Set<String> directDependents(String unitId) {
        return dependents.getOrDefault(unitId, Set.of());
    }

    /**
     * All units transitively dependent on {@code unitId}, topologically sorted
     * so that every unit appears after the units it depends on.
     */
    public List<String> getDependents(String unitId) {
        return topologicalOrder(reachable(unitId, dependents));
    }

    /**
     * All units {@code unitId} transitively depends on, upstream first.
     */
    public List<String> getDependencies(String unitId) {
        return topologicalOrder(reachable(unitId, dependencies));
    }

    public boolean hasDependents(String unitId) {
        return !directDependents(unitId).isEmpty();
    }

    public int edgeCount() {
        return edgeCount;
    }

    private static Set<String> reachable(String start, Map<String, Set<String>> adjacency) {
        Set<String> seen = new LinkedHashSet<>();
        Deque<String> queue = new ArrayDeque<>(adjacency.getOrDefault(start, Set.of()));
        while (!queue.isEmpty()) {
            String next = queue.poll();
            if (next.equals(start) || !seen.add(next)) {
                continue;
            }
            queue.addAll(adjacency.getOrDefault(next, Set.of()));
        }
        return seen;
    }

    /**
     * Kahn's algorithm over the sub-graph induced by {@code subset}; ties are
     * broken by definition order. Members of a cycle are appended last.
     */
    private List<String> topologicalOrder(Set<String> subset) {
        if (subset.isEmpty()) {
            return List.of();
        }
        Object2IntOpenHashMap<String> inDegree = new Object2IntOpenHashMap<>();
        for (String id : subset) {
            int degree = 0;
            for (String upstream : dependencies.getOrDefault(id, Set.of())) {
                if (subset.contains(upstream)) {
                    degree++;
                }
            }
            inDegree.put(id, degree);
        }

        Comparator<String> byDefinition = Comparator.comparingInt(definitionOrder::getInt);
        PriorityQueue<String> ready = new PriorityQueue<>(byDefinition);
        for (String id : subset) {
            if (inDegree.getInt(id) == 0) {
                ready.add(id);
            }
        }

        List<String> sorted = new ArrayList<>(subset.size());
        while (!ready.isEmpty()) {
            String id = ready.poll();
            sorted.add(id);
            for (String downstream : dependents.getOrDefault(id, Set.of())) {
                if (subset.contains(downstream) && inDegree.addTo(downstream, -1) == 1) {
                    ready.add(downstream);
                }
            }
        }

        if (sorted.size() < subset.size()) {
            List<String> cyclic = new ArrayList<>(subset);
            cyclic.removeAll(sorted);
            cyclic.sort(byDefinition);
            logger.warning("Visibility dependency cycle among units " + cyclic);
            sorted.addAll(cyclic);
        }
        return sorted;
    }

    private static Map<String, Set<String>> freeze(Map<String, Set<String>> source) {
        Map<String, Set<String>> copy = new LinkedHashMap<>();
        source.forEach((key, value) -> copy.put(key, Collections.unmodifiableSet(value)));
        return Collections.unmodifiableMap(copy);
    }
}
