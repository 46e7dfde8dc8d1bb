package com.eainde.graphagent.workflow;

import com.eainde.graphagent.state.SessionState;

/**
 * Read-only observer of session progress. Exceptions thrown here are logged
 * and never affect the session.
 */
public interface TransitionListener {

    default void onSessionStarted(SessionState state) {
    }

    void onTransition(TransitionRecord record);

    default void onSessionFinished(SessionState state) {
    }
}
