package com.eainde.graphagent.resolution;

import java.util.List;

/**
 * Picks the value of one property when merged candidates disagree.
 */
@FunctionalInterface
public interface PropertyConflictResolver {

    /**
     * @param property the conflicting property
     * @param values   the distinct non-null values, in cluster order
     */
    Object resolve(String property, List<Object> values);
}
