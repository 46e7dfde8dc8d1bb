package com.eainde.graphagent.model;

public record ContextSection(String name, String content) {
}
