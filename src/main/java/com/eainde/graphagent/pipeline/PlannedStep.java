package com.eainde.graphagent.pipeline;

import com.eainde.graphagent.model.ToolSignature;

/**
 * @param finalStep whether the goal is complete once this step succeeds
 */
public record PlannedStep(ToolSignature signature, boolean finalStep, String rationale) {
}
