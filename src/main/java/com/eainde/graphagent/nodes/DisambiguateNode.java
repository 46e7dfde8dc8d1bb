package com.eainde.graphagent.nodes;

import com.eainde.graphagent.config.AgentProperties;
import com.eainde.graphagent.error.ValidationException;
import com.eainde.graphagent.model.AmbiguityResolution;
import com.eainde.graphagent.model.EntityCandidate;
import com.eainde.graphagent.model.EntityResolution;
import com.eainde.graphagent.model.HumanResponse;
import com.eainde.graphagent.model.HumanResponseKind;
import com.eainde.graphagent.model.ResolvedGoalSpec;
import com.eainde.graphagent.model.SessionStatus;
import com.eainde.graphagent.pipeline.DirectStepMapper;
import com.eainde.graphagent.resolution.EntityResolver;
import com.eainde.graphagent.state.NodeName;
import com.eainde.graphagent.state.SessionState;
import com.eainde.graphagent.state.StateDelta;
import com.eainde.graphagent.state.Suspension;
import com.eainde.graphagent.state.SuspensionKind;
import lombok.extern.log4j.Log4j2;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Optional;

/**
 * Asks a human to pick between candidates, one ambiguous mention at a time.
 * <p>
 * First entry suspends the session with the question; re-entry after resume
 * applies the choice and supersedes the mention's resolution.
 * </p>
 */
@Log4j2
@Component
public class DisambiguateNode implements SessionNode {

    private final EntityResolver entityResolver;
    private final DirectStepMapper stepMapper;
    private final Clock clock;
    private final Duration timeout;

    public DisambiguateNode(EntityResolver entityResolver, DirectStepMapper stepMapper, Clock clock,
                            AgentProperties properties) {
        this.entityResolver = entityResolver;
        this.stepMapper = stepMapper;
        this.clock = clock;
        this.timeout = properties.getOrchestration().getDisambiguationTimeout();
    }

    @Override
    public StateDelta process(SessionState state) {
        ResolvedGoalSpec goal = state.resolvedGoal();
        List<AmbiguityResolution> pending = goal.pendingAmbiguities();
        if (pending.isEmpty()) {
            return StateDelta.progress("No ambiguous mentions left");
        }
        HumanResponse response = state.humanResponse();
        if (state.suspension() == null || response == null) {
            return suspend(pending.get(0), null);
        }

        switch (response.kind()) {
            case ABORT:
                return StateDelta.builder()
                        .status(SessionStatus.ABORTED)
                        .clearSuspension(true)
                        .appendProgress(List.of("Aborted while choosing an entity"))
                        .build();
            case SELECT_CANDIDATE:
            case CREATE_NEW:
                return applyChoice(goal, pending, response);
            default:
                return suspend(pending.get(0), "Expected a candidate choice, got " + response.kind());
        }
    }

    private StateDelta applyChoice(ResolvedGoalSpec goal, List<AmbiguityResolution> pending, HumanResponse response) {
        Optional<AmbiguityResolution> target = response.mention() == null
                ? Optional.of(pending.get(0))
                : pending.stream().filter(a -> a.mention().equals(response.mention())).findFirst();
        if (target.isEmpty()) {
            return suspend(pending.get(0), "No pending question for '" + response.mention() + "'");
        }
        AmbiguityResolution ambiguity = target.get();
        EntityResolution previous = goal.resolutionFor(ambiguity.mention())
                .orElseThrow(() -> new IllegalStateException("No resolution recorded for " + ambiguity.mention()));

        EntityResolution chosen;
        try {
            chosen = response.kind() == HumanResponseKind.CREATE_NEW
                    ? entityResolver.createNew(previous)
                    : entityResolver.choose(previous, response.candidateId());
        } catch (ValidationException e) {
            return suspend(ambiguity, e.getMessage());
        }

        ResolvedGoalSpec updated = goal.withResolution(chosen);
        log.info("'{}' resolved by user: {} {}", chosen.mention(), chosen.strategy(), chosen.entityKey());
        StateDelta.StateDeltaBuilder delta = StateDelta.builder()
                .resolvedGoal(updated)
                .appendResolutions(List.of(chosen))
                .clearSuspension(true)
                .clearHumanResponse(true)
                .appendProgress(List.of("'" + chosen.mention() + "' resolved to "
                        + (chosen.entityKey() == null ? "a new entity" : chosen.entityLabel() + ":" + chosen.entityKey())));
        if (updated.readyToExecute()) {
            stepMapper.directStep(updated).ifPresent(signature -> delta.signature(signature).finalStep(true));
        }
        return delta.build();
    }

    private StateDelta suspend(AmbiguityResolution ambiguity, String note) {
        Instant now = clock.instant();
        List<String> options = ambiguity.candidates().stream().map(DisambiguateNode::describe).toList();
        Suspension suspension = new Suspension(SuspensionKind.DISAMBIGUATION, NodeName.DISAMBIGUATE,
                ambiguity.question(), options, ambiguity.candidates(),
                timeout == null ? null : now.plus(timeout), now);
        String message = "Waiting for a choice for '" + ambiguity.mention() + "'";
        return StateDelta.builder()
                .status(SessionStatus.AWAITING_INPUT)
                .suspension(suspension)
                .clearHumanResponse(true)
                .appendProgress(note == null ? List.of(message) : List.of(note, message))
                .build();
    }

    private static String describe(EntityCandidate candidate) {
        return candidate.id() + ": " + candidate.name() + " [" + candidate.label() + ":" + candidate.key() + "]";
    }
}
