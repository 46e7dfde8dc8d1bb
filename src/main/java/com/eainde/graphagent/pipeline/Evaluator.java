package com.eainde.graphagent.pipeline;

import com.eainde.graphagent.model.Evaluation;
import com.eainde.graphagent.state.SessionState;

/**
 * Judges the last execution result of a session.
 */
public interface Evaluator {

    Evaluation evaluate(SessionState state);
}
