package com.eainde.graphagent.error;

/**
 * Raised by the tool registry when a signature names a tool that was never registered.
 */
public class ToolNotFoundException extends GraphAgentException {

    private final String toolName;

    public ToolNotFoundException(String toolName) {
        super(ErrorKind.TOOL_NOT_FOUND, "No tool registered with name: " + toolName);
        this.toolName = toolName;
    }

    public String getToolName() {
        return toolName;
    }
}
