package com.eainde.graphagent.graph;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Copies property bags into unmodifiable maps. Unlike {@link Map#copyOf(Map)},
 * null values are kept: a null property is meaningful to the merge strategies.
 */
public final class Props {

    private Props() {
    }

    public static Map<String, Object> copyOf(Map<String, ?> properties) {
        if (properties == null || properties.isEmpty()) {
            return Collections.emptyMap();
        }
        return Collections.unmodifiableMap(new LinkedHashMap<>(properties));
    }

    public static Map<String, Object> merge(Map<String, ?> base, Map<String, ?> overlay) {
        Map<String, Object> merged = new LinkedHashMap<>();
        if (base != null) {
            merged.putAll(base);
        }
        if (overlay != null) {
            merged.putAll(overlay);
        }
        return Collections.unmodifiableMap(merged);
    }
}
