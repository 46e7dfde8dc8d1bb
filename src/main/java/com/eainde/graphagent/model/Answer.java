package com.eainde.graphagent.model;

import com.eainde.graphagent.graph.Props;

import java.util.List;
import java.util.Map;

public record Answer(String text, boolean success, List<Artifact> artifacts, Map<String, Object> data) {

    public Answer {
        artifacts = artifacts == null ? List.of() : List.copyOf(artifacts);
        data = Props.copyOf(data);
    }
}
