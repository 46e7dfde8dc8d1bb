package com.eainde.graphagent.model;

import java.util.List;
import java.util.stream.Collectors;

/**
 * What the planner is shown for one attempt. Sections are ordered; a later
 * attempt always carries every section of an earlier one.
 */
public record ModelInput(int attempt, List<ContextSection> sections) {

    public ModelInput {
        sections = sections == null ? List.of() : List.copyOf(sections);
    }

    public String render() {
        return sections.stream()
                .map(s -> "## " + s.name() + "\n" + s.content())
                .collect(Collectors.joining("\n\n"));
    }

    public boolean hasSection(String name) {
        return sections.stream().anyMatch(s -> s.name().equals(name));
    }
}
