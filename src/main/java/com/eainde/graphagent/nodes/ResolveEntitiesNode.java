package com.eainde.graphagent.nodes;

import com.eainde.graphagent.graph.GraphContextProvider;
import com.eainde.graphagent.graph.GraphSnapshot;
import com.eainde.graphagent.model.IntentSpec;
import com.eainde.graphagent.model.ResolvedGoalSpec;
import com.eainde.graphagent.model.ToolSignature;
import com.eainde.graphagent.pipeline.DirectStepMapper;
import com.eainde.graphagent.resolution.EntityResolver;
import com.eainde.graphagent.state.SessionState;
import com.eainde.graphagent.state.StateDelta;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.Optional;

/**
 * Binds the intent's mentions against a bounded graph snapshot. A simple goal
 * that maps to a single tool call gets that call right away, skipping planning.
 */
@Component
public class ResolveEntitiesNode implements SessionNode {

    private final GraphContextProvider contextProvider;
    private final EntityResolver entityResolver;
    private final DirectStepMapper stepMapper;

    public ResolveEntitiesNode(GraphContextProvider contextProvider, EntityResolver entityResolver,
                               DirectStepMapper stepMapper) {
        this.contextProvider = contextProvider;
        this.entityResolver = entityResolver;
        this.stepMapper = stepMapper;
    }

    @Override
    public StateDelta process(SessionState state) {
        IntentSpec intent = state.intent();
        GraphSnapshot snapshot = intent.requiresGraphContext()
                ? contextProvider.snapshotFor(intent.mentions())
                : GraphSnapshot.empty("no graph context needed");
        ResolvedGoalSpec resolved = entityResolver.resolveAll(intent, snapshot);

        StateDelta.StateDeltaBuilder delta = StateDelta.builder()
                .resolvedGoal(resolved)
                .appendResolutions(resolved.resolutions())
                .appendProgress(List.of(summary(resolved)));
        Optional<ToolSignature> direct = stepMapper.directStep(resolved);
        direct.ifPresent(signature -> delta.signature(signature).finalStep(true));
        return delta.build();
    }

    static String summary(ResolvedGoalSpec resolved) {
        StringBuilder text = new StringBuilder("Resolved ").append(resolved.resolutions().size()).append(" mention(s)");
        resolved.resolutions().forEach(r -> text.append("; '").append(r.mention()).append("' -> ").append(r.strategy()));
        return text.toString();
    }
}
