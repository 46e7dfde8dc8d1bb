package com.eainde.graphagent.model;

public record Diagnosis(FailureClassification classification, Remediation remediation, String reason) {
}
