package com.eainde.graphagent.pipeline;

import com.eainde.graphagent.model.IntentSpec;

/**
 * Lightweight first pass over a goal: intent and raw mentions, no graph access.
 */
public interface IntentParser {

    IntentSpec parse(String goal);
}
