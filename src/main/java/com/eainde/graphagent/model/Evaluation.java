package com.eainde.graphagent.model;

public record Evaluation(EvaluationOutcome outcome, String reason) {
}
