package com.pulsesystems.resolver;

/**
 * A node id paired with its load level.
 * Level 0 means the node has no dependencies; otherwise it is one more than the highest
 * level among its direct dependencies.
 *
 * @param id    the node id
 * @param level the longest dependency-chain length down to a dependency-free node
 */
public record ResolvedDependency(String id, int level) {
}
