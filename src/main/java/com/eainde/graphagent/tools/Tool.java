package com.eainde.graphagent.tools;

import java.util.Map;

/**
 * A named operation the planner can call. Arguments are validated against
 * {@link #schema()} before {@link #execute(Map)} runs.
 */
public interface Tool {

    String name();

    String description();

    ToolSchema schema();

    /**
     * @return a JSON-friendly payload describing what happened
     */
    Map<String, Object> execute(Map<String, Object> arguments);
}
