package com.eainde.graphagent.tools;

import com.eainde.graphagent.error.ValidationException;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

/**
 * Argument schema of a tool: named, typed arguments, some of them required.
 * Unknown arguments are rejected.
 */
public record ToolSchema(Map<String, ArgumentType> arguments, List<String> required) {

    public ToolSchema {
        arguments = Collections.unmodifiableMap(new LinkedHashMap<>(arguments));
        required = List.copyOf(required);
    }

    public static Builder builder() {
        return new Builder();
    }

    public void validate(Map<String, Object> args) {
        List<String> problems = new ArrayList<>();
        for (String name : required) {
            Object value = args.get(name);
            if (value == null || (value instanceof String s && s.isBlank())) {
                problems.add("missing required argument '" + name + "'");
            }
        }
        for (Map.Entry<String, Object> entry : args.entrySet()) {
            ArgumentType type = arguments.get(entry.getKey());
            if (type == null) {
                problems.add("unknown argument '" + entry.getKey() + "'");
            } else if (entry.getValue() != null && !type.accepts(entry.getValue())) {
                problems.add("argument '" + entry.getKey() + "' must be of type " + type.jsonType());
            }
        }
        if (!problems.isEmpty()) {
            throw new ValidationException("Invalid arguments: " + String.join(", ", problems));
        }
    }

    /** JSON schema text of the arguments object, shown to the planner as a hint. */
    public String toJsonSchema() {
        String properties = arguments.entrySet().stream()
                .map(e -> "\"" + e.getKey() + "\": {\"type\": \"" + e.getValue().jsonType() + "\"}")
                .collect(Collectors.joining(", "));
        String requiredList = required.stream().map(r -> "\"" + r + "\"").collect(Collectors.joining(", "));
        return "{\"type\": \"object\", \"properties\": {" + properties + "}, \"required\": [" + requiredList + "]}";
    }

    public static final class Builder {
        private final Map<String, ArgumentType> arguments = new LinkedHashMap<>();
        private final List<String> required = new ArrayList<>();

        public Builder required(String name, ArgumentType type) {
            arguments.put(name, type);
            required.add(name);
            return this;
        }

        public Builder optional(String name, ArgumentType type) {
            arguments.put(name, type);
            return this;
        }

        public ToolSchema build() {
            return new ToolSchema(arguments, required);
        }
    }
}
