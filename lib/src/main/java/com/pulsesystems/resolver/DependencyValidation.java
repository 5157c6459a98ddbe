package com.pulsesystems.resolver;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Outcome of checking that every declared dependency exists.
 *
 * @param valid   true when no node references a missing id
 * @param missing offending node id to the ids it references but which are absent
 */
public record DependencyValidation(boolean valid, Map<String, List<String>> missing) {

    public DependencyValidation {
        missing = Collections.unmodifiableMap(new LinkedHashMap<>(missing));
    }
}
