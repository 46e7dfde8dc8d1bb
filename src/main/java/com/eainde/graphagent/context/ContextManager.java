package com.eainde.graphagent.context;

import com.eainde.graphagent.model.ModelInput;
import com.eainde.graphagent.state.SessionState;

/**
 * Decides how much of the session the planner sees on a given attempt.
 * Content only grows with the attempt number.
 */
public interface ContextManager {

    ModelInput prepareContext(SessionState state, int attempt);

    /** True once {@code attempt} is past the last disclosure level. */
    boolean requiresEscalation(int attempt);

    int maxAttempts();
}
