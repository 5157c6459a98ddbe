package com.pulsesystems.resolver;

import java.util.List;
import java.util.Objects;

/**
 * A named unit and the ids of the units it must be loaded after.
 * Dependencies are references by id; the node does not own them.
 *
 * @param id           unique identifier of the unit
 * @param dependencies ids this unit depends on, in declaration order
 */
public record DependencyNode(String id, List<String> dependencies) {

    public DependencyNode {
        Objects.requireNonNull(id, "id cannot be null");
        dependencies = dependencies == null ? List.of() : List.copyOf(dependencies);
    }

    /**
     * Convenience factory for literal node declarations.
     *
     * @param id           the node id
     * @param dependencies the dependency ids
     * @return a new node
     */
    public static DependencyNode of(String id, String... dependencies) {
        return new DependencyNode(id, List.of(dependencies));
    }
}
