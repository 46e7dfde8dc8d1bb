package com.eainde.graphagent.workflow;

import com.eainde.graphagent.checkpoint.CheckpointSaver;
import lombok.extern.log4j.Log4j2;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

/**
 * Moves suspended sessions whose deadline passed to {@code ESCALATION_TIMEOUT}
 * without waiting for a late response.
 */
@Log4j2
@Component
public class SuspensionSweeper {

    private final CheckpointSaver checkpointSaver;
    private final WorkflowEngine workflowEngine;

    public SuspensionSweeper(CheckpointSaver checkpointSaver, WorkflowEngine workflowEngine) {
        this.checkpointSaver = checkpointSaver;
        this.workflowEngine = workflowEngine;
    }

    @Scheduled(fixedDelayString = "${graph-agent.orchestration.sweep-interval:PT1M}")
    public void sweep() {
        sweepExpired();
    }

    public int sweepExpired() {
        int expired = 0;
        for (String sessionId : checkpointSaver.sessionIds()) {
            if (workflowEngine.expire(sessionId).isPresent()) {
                expired++;
            }
        }
        if (expired > 0) {
            log.info("Timed out {} suspended session(s)", expired);
        }
        return expired;
    }
}
