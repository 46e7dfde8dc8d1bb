package com.eainde.graphagent.model;

import com.eainde.graphagent.graph.Props;

import java.util.Map;

/**
 * A concrete tool invocation: tool name plus arguments. {@code validated} is
 * set by the executor once the arguments passed the tool's schema.
 */
public record ToolSignature(String toolName, Map<String, Object> arguments, boolean validated) {

    public ToolSignature {
        arguments = Props.copyOf(arguments);
    }

    public static ToolSignature of(String toolName, Map<String, Object> arguments) {
        return new ToolSignature(toolName, arguments, false);
    }

    public ToolSignature asValidated() {
        return new ToolSignature(toolName, arguments, true);
    }
}
