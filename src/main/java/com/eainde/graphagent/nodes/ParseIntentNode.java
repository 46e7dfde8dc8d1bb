package com.eainde.graphagent.nodes;

import com.eainde.graphagent.model.IntentSpec;
import com.eainde.graphagent.pipeline.IntentParser;
import com.eainde.graphagent.state.SessionState;
import com.eainde.graphagent.state.StateDelta;
import lombok.extern.log4j.Log4j2;
import org.springframework.stereotype.Component;

import java.util.List;

@Log4j2
@Component
public class ParseIntentNode implements SessionNode {

    private final IntentParser intentParser;

    public ParseIntentNode(IntentParser intentParser) {
        this.intentParser = intentParser;
    }

    @Override
    public StateDelta process(SessionState state) {
        // context a human supplied after a failed parse is read along with the goal
        String text = state.providedContext().isEmpty()
                ? state.goal()
                : state.goal() + "\n" + String.join("\n", state.providedContext());
        IntentSpec intent = intentParser.parse(text);
        log.info("Parsed intent {} ({}) with mentions {}", intent.intentType(), intent.complexity(), intent.mentions());
        return StateDelta.builder()
                .intent(intent)
                .appendProgress(List.of("Parsed intent " + intent.intentType() + " with mentions " + intent.mentions()))
                .build();
    }
}
