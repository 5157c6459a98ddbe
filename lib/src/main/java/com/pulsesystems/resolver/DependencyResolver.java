package com.pulsesystems.resolver;

import com.pulsesystems.Result;
import com.pulsesystems.resolver.ResolutionFailure.CyclicDependency;
import com.pulsesystems.resolver.ResolutionFailure.UnknownDependency;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.Deque;
import java.util.HashMap;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Computes a deterministic load order for named units with declared dependencies.
 *
 * <p>Resolution is a depth-first traversal started from every node in input order. Each id moves
 * from unvisited to visiting (on the current path) to resolved. Meeting a visiting id again means
 * the graph has a cycle; meeting an id outside the node set means a dependency is missing. Either
 * condition rejects the whole call, so a partial order is never returned.
 *
 * <p>The traversal keeps its own frame stack instead of recursing, so deep dependency chains do not
 * depend on the thread's stack size, and failures come back as values rather than exceptions.
 *
 * <p>Instances hold no state between calls and may be shared freely.
 *
 * <pre>{@code
 * DependencyResolver resolver = new DependencyResolver();
 * List<ResolvedDependency> order = resolver.resolve(nodes)
 *         .getOrThrow(DependencyResolutionException::new);
 * }</pre>
 */
public class DependencyResolver {

    private static final Logger logger = LoggerFactory.getLogger(DependencyResolver.class);

    private enum VisitState {
        VISITING,
        RESOLVED
    }

    /**
     * One level of the traversal: a node and the index of the next dependency to follow.
     */
    private static final class Frame {
        private final DependencyNode node;
        private int next;

        private Frame(DependencyNode node) {
            this.node = node;
        }
    }

    /**
     * Resolves the full load order.
     *
     * @param nodes the node set; when an id is declared twice, the last declaration is used
     * @return every node once, ascending by level with ties in visitation order,
     *         or the failure that stopped resolution
     */
    public Result<List<ResolvedDependency>, ResolutionFailure> resolve(List<DependencyNode> nodes) {
        Map<String, DependencyNode> nodeMap = index(nodes);
        Map<String, VisitState> states = new HashMap<>();
        Map<String, Integer> levels = new HashMap<>();
        List<ResolvedDependency> order = new ArrayList<>(nodeMap.size());

        for (DependencyNode node : nodes) {
            if (states.containsKey(node.id())) {
                continue;
            }
            Optional<ResolutionFailure> failure = visit(nodeMap.get(node.id()), nodeMap, states, levels, order);
            if (failure.isPresent()) {
                logger.debug("Dependency resolution failed: {}", failure.get().describe());
                return Result.failure(failure.get());
            }
        }

        // List.sort is stable, so equal levels keep visitation order
        order.sort(Comparator.comparingInt(ResolvedDependency::level));
        if (logger.isDebugEnabled()) {
            int depth = order.isEmpty() ? 0 : order.get(order.size() - 1).level() + 1;
            logger.debug("Resolved {} nodes into {} load levels", order.size(), depth);
        }
        return Result.success(List.copyOf(order));
    }

    /**
     * Reports whether resolution fails for any reason.
     * An unknown dependency reports true just like a cycle; use {@link #findCycle(List)} to tell them apart.
     *
     * @param nodes the node set
     * @return true if {@link #resolve(List)} would fail
     */
    public boolean hasCircularDependencies(List<DependencyNode> nodes) {
        return !resolve(nodes).isSuccess();
    }

    /**
     * Finds a dependency cycle, ignoring missing dependencies.
     *
     * @param nodes the node set
     * @return the cycle path, or empty when the known part of the graph is acyclic
     */
    public Optional<List<String>> findCycle(List<DependencyNode> nodes) {
        Set<String> known = index(nodes).keySet();
        List<DependencyNode> pruned = new ArrayList<>(nodes.size());
        for (DependencyNode node : nodes) {
            pruned.add(new DependencyNode(node.id(),
                    node.dependencies().stream().filter(known::contains).toList()));
        }
        Result<List<ResolvedDependency>, ResolutionFailure> result = resolve(pruned);
        if (!result.isSuccess() && result.failure() instanceof CyclicDependency cycle) {
            return Optional.of(cycle.path());
        }
        return Optional.empty();
    }

    /**
     * Collects every id reachable from {@code nodeId} through dependency edges.
     * Ids absent from the node set are skipped, and cycles are tolerated.
     *
     * @param nodeId the starting node
     * @param nodes  the node set
     * @return reachable ids in discovery order, never including {@code nodeId};
     *         empty if {@code nodeId} is unknown
     */
    public List<String> transitiveDependencies(String nodeId, List<DependencyNode> nodes) {
        Map<String, DependencyNode> nodeMap = index(nodes);
        DependencyNode target = nodeMap.get(nodeId);
        if (target == null) {
            return List.of();
        }

        Set<String> visited = new LinkedHashSet<>();
        Deque<Iterator<String>> stack = new ArrayDeque<>();
        stack.push(target.dependencies().iterator());
        while (!stack.isEmpty()) {
            Iterator<String> pending = stack.peek();
            if (!pending.hasNext()) {
                stack.pop();
                continue;
            }
            String depId = pending.next();
            DependencyNode dep = nodeMap.get(depId);
            if (dep == null || depId.equals(nodeId) || !visited.add(depId)) {
                continue;
            }
            stack.push(dep.dependencies().iterator());
        }
        return List.copyOf(visited);
    }

    /**
     * Lists the nodes that directly depend on {@code nodeId}. Not transitive.
     *
     * @param nodeId the dependency to look for
     * @param nodes  the node set
     * @return ids of nodes whose dependency list contains {@code nodeId}, in input order
     */
    public List<String> dependents(String nodeId, List<DependencyNode> nodes) {
        List<String> dependents = new ArrayList<>();
        for (DependencyNode node : nodes) {
            if (node.dependencies().contains(nodeId)) {
                dependents.add(node.id());
            }
        }
        return dependents;
    }

    /**
     * Checks that every declared dependency exists in the node set.
     *
     * @param nodes the node set
     * @return validity flag plus the missing ids per offending node
     */
    public DependencyValidation validateDependencies(List<DependencyNode> nodes) {
        Set<String> known = index(nodes).keySet();
        Map<String, List<String>> missing = new LinkedHashMap<>();
        for (DependencyNode node : nodes) {
            List<String> absent = node.dependencies().stream()
                    .filter(dep -> !known.contains(dep))
                    .toList();
            if (!absent.isEmpty()) {
                missing.put(node.id(), absent);
            }
        }
        return new DependencyValidation(missing.isEmpty(), missing);
    }

    /**
     * Computes what has to be (re)loaded when {@code newNode} joins an existing set.
     *
     * @param newNode       the unit being added
     * @param existingNodes the units already known
     * @return ids from {@code newNode} to the end of the combined load order, or the resolution failure
     */
    public Result<List<String>, ResolutionFailure> loadOrderFor(DependencyNode newNode,
                                                                 List<DependencyNode> existingNodes) {
        List<DependencyNode> all = new ArrayList<>(existingNodes);
        all.add(newNode);
        return resolve(all).map(order -> {
            for (int i = 0; i < order.size(); i++) {
                if (order.get(i).id().equals(newNode.id())) {
                    return order.subList(i, order.size()).stream()
                            .map(ResolvedDependency::id)
                            .toList();
                }
            }
            return List.<String>of();
        });
    }

    private Optional<ResolutionFailure> visit(DependencyNode root,
                                              Map<String, DependencyNode> nodeMap,
                                              Map<String, VisitState> states,
                                              Map<String, Integer> levels,
                                              List<ResolvedDependency> order) {
        Deque<Frame> stack = new ArrayDeque<>();
        stack.push(new Frame(root));
        states.put(root.id(), VisitState.VISITING);

        while (!stack.isEmpty()) {
            Frame frame = stack.peek();
            List<String> dependencies = frame.node.dependencies();

            if (frame.next < dependencies.size()) {
                String depId = dependencies.get(frame.next++);
                VisitState state = states.get(depId);
                if (state == VisitState.RESOLVED) {
                    continue;
                }
                if (state == VisitState.VISITING) {
                    return Optional.of(new CyclicDependency(cyclePath(stack, depId)));
                }
                DependencyNode dep = nodeMap.get(depId);
                if (dep == null) {
                    return Optional.of(new UnknownDependency(depId, frame.node.id()));
                }
                states.put(depId, VisitState.VISITING);
                stack.push(new Frame(dep));
                continue;
            }

            stack.pop();
            int level = 0;
            for (String depId : dependencies) {
                level = Math.max(level, levels.get(depId) + 1);
            }
            String id = frame.node.id();
            states.put(id, VisitState.RESOLVED);
            levels.put(id, level);
            order.add(new ResolvedDependency(id, level));
        }
        return Optional.empty();
    }

    private static List<String> cyclePath(Deque<Frame> stack, String repeatedId) {
        List<String> path = new ArrayList<>();
        boolean inCycle = false;
        Iterator<Frame> fromRoot = stack.descendingIterator();
        while (fromRoot.hasNext()) {
            String id = fromRoot.next().node.id();
            inCycle = inCycle || id.equals(repeatedId);
            if (inCycle) {
                path.add(id);
            }
        }
        path.add(repeatedId);
        return path;
    }

    private static Map<String, DependencyNode> index(List<DependencyNode> nodes) {
        Map<String, DependencyNode> nodeMap = new LinkedHashMap<>();
        for (DependencyNode node : nodes) {
            nodeMap.put(node.id(), node);
        }
        return nodeMap;
    }
}
