package com.pulsesystems.resolver;

import java.util.List;

/**
 * Why a dependency resolution was rejected.
 */
public sealed interface ResolutionFailure
        permits ResolutionFailure.CyclicDependency, ResolutionFailure.UnknownDependency {

    /**
     * Human-readable description, suitable for logs and exception messages.
     */
    String describe();

    /**
     * The dependency relation loops back on itself.
     *
     * @param path ids from the first occurrence of the repeated id back to that id again,
     *             e.g. {@code [a, b, c, a]}
     */
    record CyclicDependency(List<String> path) implements ResolutionFailure {
        public CyclicDependency {
            path = List.copyOf(path);
        }

        @Override
        public String describe() {
            return "Circular dependency detected: " + String.join(" -> ", path);
        }
    }

    /**
     * A node references an id that is not part of the node set.
     *
     * @param missingId   the id that could not be found
     * @param requesterId the node that declared the dependency
     */
    record UnknownDependency(String missingId, String requesterId) implements ResolutionFailure {
        @Override
        public String describe() {
            return "Unknown dependency: " + missingId + " (required by " + requesterId + ")";
        }
    }
}
