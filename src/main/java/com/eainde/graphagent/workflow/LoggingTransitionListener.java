package com.eainde.graphagent.workflow;

import com.eainde.graphagent.state.SessionState;
import lombok.extern.log4j.Log4j2;
import org.springframework.stereotype.Component;

@Log4j2
@Component
public class LoggingTransitionListener implements TransitionListener {

    @Override
    public void onSessionStarted(SessionState state) {
        log.info("Session started: goal='{}'", state.goal());
    }

    @Override
    public void onTransition(TransitionRecord record) {
        log.info("[v{}] {} -> {} ({}) in {}ms", record.version(), record.from(), record.to(),
                record.status(), record.durationMs());
        record.progress().forEach(message -> log.debug("  {}", message));
    }

    @Override
    public void onSessionFinished(SessionState state) {
        log.info("Session finished: status={}, steps={}, failures={}",
                state.status(), state.completedSteps(), state.failures().size());
    }
}
