package com.eainde.graphagent.nodes;

import com.eainde.graphagent.model.Answer;
import com.eainde.graphagent.model.Artifact;
import com.eainde.graphagent.model.SessionStatus;
import com.eainde.graphagent.state.SessionState;
import com.eainde.graphagent.state.StateDelta;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.Map;

@Component
public class AnswerNode implements SessionNode {

    @Override
    public StateDelta process(SessionState state) {
        StringBuilder text = new StringBuilder("Done: ").append(state.goal())
                .append(" (").append(state.completedSteps()).append(" step(s))");
        for (Artifact artifact : state.artifacts()) {
            text.append("\n- ").append(artifact.type()).append(' ').append(artifact.description());
        }
        Map<String, Object> data = state.lastResult() == null ? Map.of() : state.lastResult().payload();
        return StateDelta.builder()
                .status(SessionStatus.COMPLETED)
                .answer(new Answer(text.toString(), true, state.artifacts(), data))
                .appendProgress(List.of("Goal completed"))
                .build();
    }
}
