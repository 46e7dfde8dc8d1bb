package com.eainde.graphagent.workflow;

import com.eainde.graphagent.checkpoint.CheckpointSaver;
import com.eainde.graphagent.edges.SessionEdge;
import com.eainde.graphagent.error.ErrorKind;
import com.eainde.graphagent.error.GraphAgentException;
import com.eainde.graphagent.error.NotFoundException;
import com.eainde.graphagent.error.ValidationException;
import com.eainde.graphagent.model.Failure;
import com.eainde.graphagent.model.HumanResponse;
import com.eainde.graphagent.model.HumanResponseKind;
import com.eainde.graphagent.model.SessionStatus;
import com.eainde.graphagent.nodes.SessionNode;
import com.eainde.graphagent.state.GoalState;
import com.eainde.graphagent.state.NodeName;
import com.eainde.graphagent.state.SessionState;
import com.eainde.graphagent.state.StateDelta;
import com.eainde.graphagent.state.Suspension;
import com.eainde.graphagent.state.SuspensionKind;
import lombok.extern.log4j.Log4j2;
import org.bsc.langgraph4j.CompileConfig;
import org.bsc.langgraph4j.CompiledGraph;
import org.bsc.langgraph4j.GraphStateException;
import org.bsc.langgraph4j.RunnableConfig;
import org.bsc.langgraph4j.action.AsyncEdgeAction;
import org.bsc.langgraph4j.action.AsyncNodeAction;

import java.time.Clock;
import java.time.Instant;
import java.util.EnumSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;
import java.util.function.BooleanSupplier;

/**
 * Drives sessions through the compiled LangGraph4j workflow.
 * <p>
 * The graph runs with {@code threadId = sessionId} and checkpoints every
 * transition through the {@link CheckpointSaver}, so a session can be resumed
 * by any orchestrator that shares the saver. A run stops when the session
 * suspends, reaches a terminal status or uses up its transition budget.
 * </p>
 *
 * <h3>Failure handling</h3>
 * <ul>
 * <li>An exception escaping a node is recorded as an {@code INTERNAL} failure and
 * the session is routed to {@code ESCALATE}; if escalation itself fails the
 * session fails.</li>
 * <li>Running out of transitions fails the session.</li>
 * <li>An abort request is honoured between transitions.</li>
 * </ul>
 */
@Log4j2
public class Orchestrator {

    private static final Set<HumanResponseKind> DISAMBIGUATION_RESPONSES =
            EnumSet.of(HumanResponseKind.SELECT_CANDIDATE, HumanResponseKind.CREATE_NEW, HumanResponseKind.ABORT);
    private static final Set<HumanResponseKind> CANDIDATE_CHOICES =
            EnumSet.of(HumanResponseKind.SELECT_CANDIDATE, HumanResponseKind.CREATE_NEW);

    private final CompiledGraph<GoalState> graph;
    private final CheckpointSaver checkpointSaver;
    private final List<TransitionListener> listeners;
    private final Clock clock;
    private final int maxTransitions;
    private final int maxRetries;
    private final int historyLimit;
    private final Map<String, Run> runs = new ConcurrentHashMap<>();

    public Orchestrator(WorkflowDefinition workflow, CheckpointSaver checkpointSaver,
                        List<TransitionListener> listeners, Clock clock,
                        int maxTransitions, int maxRetries, int historyLimit) {
        this.checkpointSaver = checkpointSaver;
        this.listeners = List.copyOf(listeners);
        this.clock = clock;
        this.maxTransitions = maxTransitions;
        this.maxRetries = maxRetries;
        this.historyLimit = historyLimit;
        try {
            this.graph = workflow.define(new Guard()).compile(
                    CompileConfig.builder()
                            .checkpointSaver(checkpointSaver)
                            .build());
        } catch (GraphStateException e) {
            throw new IllegalStateException("Goal workflow does not compile: " + e.getMessage(), e);
        }
        // the budget check must trip before the library's own iteration cap
        this.graph.setMaxIterations(maxTransitions + NodeName.values().length);
    }

    public SessionState start(String sessionId, String goal) {
        return start(sessionId, goal, () -> false);
    }

    public SessionState start(String sessionId, String goal, BooleanSupplier abortRequested) {
        if (goal == null || goal.isBlank()) {
            throw new ValidationException("Goal must not be empty");
        }
        if (checkpointSaver.load(sessionId).isPresent()) {
            throw new ValidationException("Session already exists: " + sessionId);
        }
        SessionState state = SessionState.start(sessionId, goal, maxRetries, historyLimit, clock.instant());
        checkpointSaver.save(state);
        listeners.forEach(listener -> notify(() -> listener.onSessionStarted(state)));
        return run(state, abortRequested);
    }

    public SessionState resume(String sessionId, HumanResponse response) {
        return resume(sessionId, response, () -> false);
    }

    /**
     * Re-enters the suspended node with the human's response. A response that
     * arrives after the suspension deadline moves the session to
     * {@code ESCALATION_TIMEOUT} instead.
     *
     * @throws NotFoundException   if no checkpoint exists for the session
     * @throws ValidationException if the session is not waiting for input or the
     *                             response does not fit the suspension
     */
    public SessionState resume(String sessionId, HumanResponse response, BooleanSupplier abortRequested) {
        SessionState state = require(sessionId);
        if (!state.isSuspended()) {
            throw new ValidationException("Session " + sessionId + " is not awaiting input (status " + state.status() + ")");
        }
        if (response == null || response.kind() == null) {
            throw new ValidationException("A response kind is required");
        }
        Suspension suspension = state.suspension();
        if (suspension.kind() == SuspensionKind.DISAMBIGUATION && !DISAMBIGUATION_RESPONSES.contains(response.kind())) {
            throw new ValidationException("Response " + response.kind() + " does not answer a disambiguation question");
        }
        if (suspension.kind() == SuspensionKind.ESCALATION && CANDIDATE_CHOICES.contains(response.kind())) {
            throw new ValidationException("Response " + response.kind() + " picks a candidate, but no candidate question is open");
        }

        Instant now = clock.instant();
        if (suspension.isExpired(now)) {
            log.warn("Response for session {} arrived after deadline {}", sessionId, suspension.deadline());
            return run(state.toBuilder().status(SessionStatus.RUNNING).currentNode(NodeName.ESCALATION_TIMEOUT)
                    .updatedAt(now).build(), abortRequested);
        }

        log.info("Resuming session {} at {} with {}", sessionId, suspension.node(), response.kind());
        SessionState resumed = state.toBuilder()
                .status(SessionStatus.RUNNING)
                .currentNode(suspension.node())
                .humanResponse(response)
                .updatedAt(now)
                .build();
        return run(resumed, abortRequested);
    }

    /**
     * Aborts a session that is not currently running in this process. Terminal
     * sessions are returned unchanged.
     */
    public SessionState abort(String sessionId) {
        SessionState state = require(sessionId);
        if (state.status().isTerminal()) {
            return state;
        }
        SessionState aborted = terminate(state, SessionStatus.ABORTED, "Aborted on request", null);
        checkpointSaver.save(aborted);
        listeners.forEach(listener -> notify(() -> listener.onSessionFinished(aborted)));
        return aborted;
    }

    /**
     * Times out the session if its suspension deadline has passed.
     *
     * @return the timed-out state, or empty if the session was not due
     */
    public Optional<SessionState> expire(String sessionId) {
        Optional<SessionState> loaded = checkpointSaver.load(sessionId);
        if (loaded.isEmpty() || !loaded.get().isSuspended() || !loaded.get().suspension().isExpired(clock.instant())) {
            return Optional.empty();
        }
        SessionState state = loaded.get();
        log.info("Suspension of session {} expired at {}", sessionId, state.suspension().deadline());
        return Optional.of(run(state.toBuilder().status(SessionStatus.RUNNING)
                .currentNode(NodeName.ESCALATION_TIMEOUT).build(), () -> false));
    }

    public Optional<SessionState> load(String sessionId) {
        return checkpointSaver.load(sessionId);
    }

    SessionState run(SessionState initial, BooleanSupplier abortRequested) {
        String sessionId = initial.sessionId();
        runs.put(sessionId, new Run(abortRequested));
        SessionState state;
        try {
            RunnableConfig config = RunnableConfig.builder()
                    .threadId(sessionId)
                    .build();
            state = graph.invoke(GoalState.of(initial), config)
                    .map(GoalState::session)
                    .orElse(initial);
        } catch (RuntimeException e) {
            throw unwrap(e);
        } finally {
            runs.remove(sessionId);
        }

        SessionState settled = GoalState.positioned(state, null);
        checkpointSaver.save(settled);
        if (settled.status().isTerminal()) {
            listeners.forEach(listener -> notify(() -> listener.onSessionFinished(settled)));
        }
        return settled;
    }

    private SessionState recover(SessionState state, NodeName from, RuntimeException error, Instant now) {
        log.error("Node {} failed unexpectedly", from, error);
        Failure failure = new Failure(ErrorKind.INTERNAL, String.valueOf(error.getMessage()), from.name(),
                null, Map.of(), state.completedSteps(), state.attempt(), now);

        StateDelta.StateDeltaBuilder delta = StateDelta.builder()
                .appendFailures(List.of(failure))
                .appendProgress(List.of(failureLine(from, error)))
                .clearSuspension(true);
        if (from == NodeName.ESCALATE) {
            delta.status(SessionStatus.FAILED);
        }
        return GoalState.advance(state, delta.build(), now);
    }

    private static String failureLine(NodeName node, RuntimeException error) {
        return node + " failed: " + error.getMessage();
    }

    private SessionState terminate(SessionState state, SessionStatus status, String reason, ErrorKind kind) {
        Instant now = clock.instant();
        StateDelta.StateDeltaBuilder delta = StateDelta.builder()
                .status(status)
                .clearSuspension(true)
                .appendProgress(List.of(reason));
        if (kind != null) {
            delta.appendFailures(List.of(new Failure(kind, reason, String.valueOf(state.currentNode()), null, Map.of(),
                    state.completedSteps(), state.attempt(), now)));
        }
        return GoalState.advance(state, delta.build(), now);
    }

    private SessionState require(String sessionId) {
        return checkpointSaver.load(sessionId)
                .orElseThrow(() -> new NotFoundException("No session found with id: " + sessionId));
    }

    private Run runOf(SessionState session) {
        Run run = runs.get(session.sessionId());
        if (run == null) {
            throw new IllegalStateException("Session " + session.sessionId() + " is not running here");
        }
        return run;
    }

    /**
     * The graph runtime may wrap what a node or the saver threw; callers get
     * the agent's own exception back.
     */
    private static RuntimeException unwrap(RuntimeException error) {
        Throwable cause = error;
        while (cause != null) {
            if (cause instanceof GraphAgentException) {
                return (GraphAgentException) cause;
            }
            cause = cause.getCause();
        }
        return error;
    }

    private static void notify(Runnable callback) {
        try {
            callback.run();
        } catch (RuntimeException e) {
            log.warn("Transition listener failed", e);
        }
    }

    /**
     * Bookkeeping of one graph invocation. A node records what it did; the
     * routing edge that follows completes the record once the target is known.
     */
    private static final class Run {
        private final BooleanSupplier abortRequested;
        private int transitions;
        private NodeName from;
        private List<String> progress = List.of();
        private Instant at;
        private long startedNanos;
        private boolean recovered;

        private Run(BooleanSupplier abortRequested) {
            this.abortRequested = abortRequested;
        }
    }

    private final class Guard implements TransitionGuard {

        @Override
        public AsyncNodeAction<GoalState> node(NodeName name, SessionNode node) {
            return state -> {
                SessionState session = state.session();
                Run run = runOf(session);
                run.from = null;
                run.recovered = false;

                if (run.abortRequested.getAsBoolean()) {
                    log.info("Abort requested, stopping before {}", name);
                    return done(terminate(session, SessionStatus.ABORTED, "Aborted on request", null));
                }
                if (run.transitions++ >= maxTransitions) {
                    log.error("Transition budget of {} exhausted at {}", maxTransitions, name);
                    return done(terminate(session, SessionStatus.FAILED, "Transition budget exhausted",
                            ErrorKind.INTERNAL));
                }

                run.from = name;
                run.at = clock.instant();
                run.startedNanos = System.nanoTime();
                SessionState next;
                try {
                    StateDelta delta = node.process(session);
                    run.progress = delta.appendProgress() == null ? List.of() : delta.appendProgress();
                    next = GoalState.advance(session, delta, run.at);
                } catch (RuntimeException e) {
                    next = recover(session, name, e, run.at);
                    run.progress = List.of(failureLine(name, e));
                    run.recovered = true;
                }
                return done(next);
            };
        }

        @Override
        public AsyncEdgeAction<GoalState> edge(NodeName from, SessionEdge edge) {
            return state -> {
                SessionState session = state.session();
                Run run = runOf(session);
                NodeName next;
                if (run.recovered && !session.status().isTerminal()) {
                    next = NodeName.ESCALATE;
                } else {
                    next = NodeName.valueOf(edge.apply(state).join());
                }
                if (run.from != null) {
                    TransitionRecord record = new TransitionRecord(session.sessionId(), session.version(), run.from,
                            GoalState.restingNode(session, next), session.status(), run.progress,
                            session.failures().size(), run.at, (System.nanoTime() - run.startedNanos) / 1_000_000);
                    listeners.forEach(listener -> Orchestrator.notify(() -> listener.onTransition(record)));
                }
                return CompletableFuture.completedFuture(next.name());
            };
        }

        private CompletableFuture<Map<String, Object>> done(SessionState next) {
            return CompletableFuture.completedFuture(GoalState.of(next));
        }
    }
}
