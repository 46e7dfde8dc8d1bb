package com.eainde.graphagent.nodes;

import com.eainde.graphagent.error.ErrorKind;
import com.eainde.graphagent.model.Artifact;
import com.eainde.graphagent.model.ExecutionResult;
import com.eainde.graphagent.model.Failure;
import com.eainde.graphagent.model.ToolSignature;
import com.eainde.graphagent.state.NodeName;
import com.eainde.graphagent.state.SessionState;
import com.eainde.graphagent.state.StateDelta;
import com.eainde.graphagent.tools.GraphTools;
import com.eainde.graphagent.tools.ToolExecutor;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Instant;
import java.util.List;
import java.util.Map;

@Component
public class ExecuteToolNode implements SessionNode {

    private final ToolExecutor toolExecutor;
    private final Clock clock;

    public ExecuteToolNode(ToolExecutor toolExecutor, Clock clock) {
        this.toolExecutor = toolExecutor;
        this.clock = clock;
    }

    @Override
    public StateDelta process(SessionState state) {
        ToolSignature signature = state.currentSignature();
        Instant now = clock.instant();
        ExecutionResult result = signature == null
                ? ExecutionResult.validationError(null, ErrorKind.VALIDATION, "No tool call was planned")
                : toolExecutor.execute(signature);

        StateDelta.StateDeltaBuilder delta = StateDelta.builder().lastResult(result);
        if (result.isSuccess()) {
            delta.signature(signature.asValidated())
                    .appendArtifacts(List.of(artifactFor(signature, result, state.completedSteps(), now)))
                    .appendProgress(List.of("Executed " + signature.toolName()));
        } else {
            delta.appendFailures(List.of(new Failure(result.errorKind(), result.error(), NodeName.EXECUTE_TOOL.name(),
                            result.toolName(), signature == null ? Map.of() : signature.arguments(),
                            state.completedSteps(), state.attempt(), now)))
                    .appendProgress(List.of(result.toolName() + " failed (" + result.errorKind() + "): " + result.error()));
        }
        return delta.build();
    }

    static Artifact artifactFor(ToolSignature signature, ExecutionResult result, int stepIndex, Instant now) {
        Map<String, Object> payload = result.payload();
        Map<String, Object> args = signature.arguments();
        switch (signature.toolName()) {
            case GraphTools.ADD_NODE:
                return new Artifact(Boolean.TRUE.equals(payload.get("created")) ? "node_created" : "node_merged",
                        String.valueOf(payload.get("node_id")),
                        args.get("label") + ":" + args.get("key"), stepIndex, now);
            case GraphTools.ADD_EDGE:
                return new Artifact("edge_upserted", String.valueOf(payload.get("edge_id")),
                        args.get("source_label") + ":" + args.get("source_key") + " -[" + args.get("type") + "]-> "
                                + args.get("target_label") + ":" + args.get("target_key"), stepIndex, now);
            case GraphTools.UPDATE_PROPS:
                return new Artifact("node_updated", args.get("label") + ":" + args.get("key"),
                        "Updated " + payload.get("updated") + " element(s)", stepIndex, now);
            case GraphTools.DELETE_NODE:
            case GraphTools.DELETE_EDGE:
                return new Artifact("deleted", signature.toolName(),
                        "Deleted " + payload.get("deleted") + " element(s)", stepIndex, now);
            default:
                return new Artifact("query_result", signature.toolName(),
                        payload.containsKey("count") ? payload.get("count") + " row(s)" : "Read completed",
                        stepIndex, now);
        }
    }
}
