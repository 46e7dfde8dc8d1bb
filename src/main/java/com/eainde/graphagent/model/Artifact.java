package com.eainde.graphagent.model;

import java.time.Instant;

/**
 * Something a successful step produced, e.g. a created node.
 */
public record Artifact(String type, String reference, String description, int stepIndex, Instant createdAt) {
}
