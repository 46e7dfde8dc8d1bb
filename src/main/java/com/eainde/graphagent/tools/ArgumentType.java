package com.eainde.graphagent.tools;

import java.util.Map;

public enum ArgumentType {
    STRING("string"),
    INTEGER("integer"),
    OBJECT("object");

    private final String jsonType;

    ArgumentType(String jsonType) {
        this.jsonType = jsonType;
    }

    public String jsonType() {
        return jsonType;
    }

    boolean accepts(Object value) {
        return switch (this) {
            case STRING -> value instanceof String;
            case INTEGER -> value instanceof Integer || value instanceof Long
                    || (value instanceof String s && s.matches("-?\\d+"));
            case OBJECT -> value instanceof Map;
        };
    }
}
