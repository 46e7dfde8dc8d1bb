package com.eainde.graphagent.tools;

import com.eainde.graphagent.error.ToolNotFoundException;
import lombok.extern.log4j.Log4j2;

import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Name-keyed tool lookup. Fails closed: an unknown name is an error, never a guess.
 */
@Log4j2
public class ToolRegistry {

    private final Map<String, Tool> tools = new ConcurrentHashMap<>();

    public ToolRegistry(Collection<Tool> tools) {
        tools.forEach(this::register);
    }

    public void register(Tool tool) {
        Tool previous = tools.putIfAbsent(tool.name(), tool);
        if (previous != null) {
            throw new IllegalStateException("Tool already registered: " + tool.name());
        }
        log.debug("Registered tool {}", tool.name());
    }

    public Tool get(String name) {
        Tool tool = name == null ? null : tools.get(name);
        if (tool == null) {
            throw new ToolNotFoundException(name);
        }
        return tool;
    }

    public boolean contains(String name) {
        return name != null && tools.containsKey(name);
    }

    public List<String> names() {
        return tools.keySet().stream().sorted().toList();
    }

    /** Name to "description + argument schema", sorted by name. */
    public Map<String, String> describe() {
        Map<String, String> descriptions = new LinkedHashMap<>();
        for (String name : names()) {
            Tool tool = tools.get(name);
            descriptions.put(name, tool.description() + " Arguments: " + tool.schema().toJsonSchema());
        }
        return descriptions;
    }
}
