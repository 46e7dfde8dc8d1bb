package com.eainde.graphagent.nodes;

import com.eainde.graphagent.state.GoalState;
import com.eainde.graphagent.state.SessionState;
import com.eainde.graphagent.state.StateDelta;
import org.bsc.langgraph4j.action.AsyncNodeAction;

import java.time.Instant;
import java.util.Map;
import java.util.concurrent.CompletableFuture;

/**
 * A goal workflow node. {@link #process} reads the session and returns the
 * change to apply; it never mutates the state or decides where to go next.
 */
@FunctionalInterface
public interface SessionNode extends AsyncNodeAction<GoalState> {

    StateDelta process(SessionState state);

    @Override
    default CompletableFuture<Map<String, Object>> apply(GoalState state) {
        SessionState session = state.session();
        return CompletableFuture.completedFuture(GoalState.of(GoalState.advance(session, process(session), Instant.now())));
    }
}
