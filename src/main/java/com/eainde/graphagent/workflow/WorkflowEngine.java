package com.eainde.graphagent.workflow;

import com.eainde.graphagent.error.CheckpointException;
import com.eainde.graphagent.error.NotFoundException;
import com.eainde.graphagent.model.HumanResponse;
import com.eainde.graphagent.state.SessionState;
import lombok.extern.log4j.Log4j2;
import org.slf4j.MDC;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Service;

import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.UUID;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.Executor;
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.Supplier;

/**
 * The central entry point for running goal sessions.
 * <p>
 * A facade over the {@link Orchestrator} that hands out session ids, serializes
 * calls per session and puts the session id in the MDC for every log line
 * written on its behalf.
 * </p>
 *
 * <h3>Key Features:</h3>
 * <ul>
 * <li><strong>ID Management:</strong> generates a UUID per session.</li>
 * <li><strong>Ordering:</strong> start, resume and abort of one session never overlap; different sessions run concurrently.</li>
 * <li><strong>Abort:</strong> a running session stops before its next transition; a suspended one is aborted at once.</li>
 * <li><strong>Outcomes:</strong> checkpoint failures come back as a failed {@link SessionOutcome}.</li>
 * </ul>
 *
 * Caller mistakes (empty goal, unknown session, a response to a session that is
 * not waiting) are thrown as {@link com.eainde.graphagent.error.ValidationException}
 * or {@link NotFoundException}.
 */
@Log4j2
@Service
public class WorkflowEngine {

    static final String MDC_SESSION_ID = "sessionId";

    private final Orchestrator orchestrator;
    private final Executor executor;
    private final Map<String, SessionLock> locks = new ConcurrentHashMap<>();
    private final Set<String> abortRequests = ConcurrentHashMap.newKeySet();

    public WorkflowEngine(Orchestrator orchestrator, @Qualifier("sessionExecutor") Executor sessionExecutor) {
        this.orchestrator = orchestrator;
        this.executor = sessionExecutor;
    }

    public SessionOutcome start(String goal) {
        return start(UUID.randomUUID().toString(), goal);
    }

    public SessionOutcome start(String sessionId, String goal) {
        return withSession(sessionId, () -> orchestrator.start(sessionId, goal, () -> abortRequests.contains(sessionId)));
    }

    /**
     * Starts the session on the session executor and returns as soon as the id
     * is known; the future completes when the session finishes or suspends.
     */
    public CompletableFuture<SessionOutcome> startAsync(String goal) {
        String sessionId = UUID.randomUUID().toString();
        MDC.put(MDC_SESSION_ID, sessionId);
        try {
            return CompletableFuture.supplyAsync(() -> start(sessionId, goal), executor);
        } finally {
            MDC.remove(MDC_SESSION_ID);
        }
    }

    public SessionOutcome resume(String sessionId, HumanResponse response) {
        return withSession(sessionId,
                () -> orchestrator.resume(sessionId, response, () -> abortRequests.contains(sessionId)));
    }

    /**
     * Flags the session for abort, then aborts it directly once no other call
     * holds it. A running call picks the flag up between transitions.
     */
    public SessionOutcome abort(String sessionId) {
        abortRequests.add(sessionId);
        log.info("Abort requested for session {}", sessionId);
        try {
            return withSession(sessionId, () -> orchestrator.abort(sessionId));
        } catch (NotFoundException e) {
            abortRequests.remove(sessionId);
            throw e;
        }
    }

    public Optional<SessionOutcome> status(String sessionId) {
        return orchestrator.load(sessionId).map(SessionOutcome::from);
    }

    public Optional<SessionOutcome> expire(String sessionId) {
        SessionLock lock = acquire(sessionId);
        if (!lock.tryLock()) {
            // someone is resuming it right now
            release(sessionId, lock, false);
            return Optional.empty();
        }
        MDC.put(MDC_SESSION_ID, sessionId);
        try {
            return orchestrator.expire(sessionId).map(SessionOutcome::from);
        } finally {
            MDC.remove(MDC_SESSION_ID);
            release(sessionId, lock, true);
        }
    }

    private SessionOutcome withSession(String sessionId, Supplier<SessionState> call) {
        SessionLock lock = acquire(sessionId);
        lock.lock();
        MDC.put(MDC_SESSION_ID, sessionId);
        try {
            SessionState state = call.get();
            if (state.status().isTerminal()) {
                abortRequests.remove(sessionId);
            }
            return SessionOutcome.from(state);
        } catch (CheckpointException e) {
            log.error("Checkpoint failure for session {}", sessionId, e);
            return SessionOutcome.failed(sessionId, e.getKind(), e.getMessage());
        } finally {
            MDC.remove(MDC_SESSION_ID);
            release(sessionId, lock, true);
        }
    }

    /** Sessions with a call in progress or waiting. */
    int activeSessions() {
        return locks.size();
    }

    private SessionLock acquire(String sessionId) {
        return locks.compute(sessionId, (id, lock) -> {
            SessionLock held = lock == null ? new SessionLock() : lock;
            held.users++;
            return held;
        });
    }

    private void release(String sessionId, SessionLock lock, boolean locked) {
        if (locked) {
            lock.unlock();
        }
        locks.computeIfPresent(sessionId, (id, held) -> --held.users == 0 ? null : held);
    }

    /** A lock that leaves the map once its last user is done. Users are counted under the map's key lock. */
    private static final class SessionLock extends ReentrantLock {
        private int users;
    }
}
