package com.eainde.graphagent.context;

import com.eainde.graphagent.model.Artifact;
import com.eainde.graphagent.model.ContextSection;
import com.eainde.graphagent.model.EntityResolution;
import com.eainde.graphagent.model.Failure;
import com.eainde.graphagent.model.ModelInput;
import com.eainde.graphagent.state.SessionState;
import com.eainde.graphagent.tools.ToolRegistry;

import java.util.ArrayList;
import java.util.List;
import java.util.stream.Collectors;

/**
 * Three disclosure levels.
 * <ol>
 * <li>goal with resolved bindings, tool hints, user-provided context</li>
 * <li>+ the latest structured error</li>
 * <li>+ recent progress, every failure of the current step and a plan recap</li>
 * </ol>
 * Attempts beyond the last level reuse it; callers are expected to escalate
 * instead, see {@link #requiresEscalation(int)}.
 */
public class ProgressiveContextManager implements ContextManager {

    public static final String GOAL = "goal";
    public static final String TOOLS = "tools";
    public static final String USER_CONTEXT = "user_context";
    public static final String LATEST_ERROR = "latest_error";
    public static final String HISTORY = "history";
    public static final String FAILURES = "failures";
    public static final String PLAN_RECAP = "plan_recap";

    private static final int LEVELS = 3;

    private final ToolRegistry toolRegistry;
    private final int maxAttempts;
    private final int historyWindow;

    public ProgressiveContextManager(ToolRegistry toolRegistry, int maxAttempts, int historyWindow) {
        if (maxAttempts < 1) {
            throw new IllegalArgumentException("maxAttempts must be positive");
        }
        this.toolRegistry = toolRegistry;
        this.maxAttempts = maxAttempts;
        this.historyWindow = historyWindow;
    }

    @Override
    public ModelInput prepareContext(SessionState state, int attempt) {
        int level = Math.max(1, Math.min(attempt, LEVELS));
        List<ContextSection> sections = new ArrayList<>();

        sections.add(new ContextSection(GOAL, goalSection(state)));
        sections.add(new ContextSection(TOOLS, toolSection()));
        if (!state.providedContext().isEmpty()) {
            sections.add(new ContextSection(USER_CONTEXT, String.join("\n", state.providedContext())));
        }
        if (level >= 2) {
            List<Failure> failures = state.currentStepFailures();
            sections.add(new ContextSection(LATEST_ERROR, failures.isEmpty()
                    ? "No errors recorded."
                    : describe(failures.get(failures.size() - 1))));
        }
        if (level >= 3) {
            List<String> progress = state.progress();
            sections.add(new ContextSection(HISTORY, String.join("\n",
                    progress.subList(Math.max(0, progress.size() - historyWindow), progress.size()))));
            sections.add(new ContextSection(FAILURES, state.currentStepFailures().stream()
                    .map(ProgressiveContextManager::describe)
                    .collect(Collectors.joining("\n"))));
            sections.add(new ContextSection(PLAN_RECAP, planRecap(state)));
        }
        return new ModelInput(attempt, sections);
    }

    @Override
    public boolean requiresEscalation(int attempt) {
        return attempt > maxAttempts;
    }

    @Override
    public int maxAttempts() {
        return maxAttempts;
    }

    private static String goalSection(SessionState state) {
        StringBuilder goal = new StringBuilder(state.goal() == null ? "" : state.goal());
        if (state.resolvedGoal() != null) {
            for (EntityResolution resolution : state.resolvedGoal().resolutions()) {
                goal.append("\n- '").append(resolution.mention()).append("' -> ").append(resolution.strategy());
                if (resolution.entityKey() != null) {
                    goal.append(' ').append(resolution.entityLabel()).append(':').append(resolution.entityKey());
                }
            }
        }
        return goal.toString();
    }

    private String toolSection() {
        return toolRegistry.describe().entrySet().stream()
                .map(e -> e.getKey() + ": " + e.getValue())
                .collect(Collectors.joining("\n"));
    }

    private static String planRecap(SessionState state) {
        StringBuilder recap = new StringBuilder("Completed steps: ").append(state.completedSteps());
        for (Artifact artifact : state.artifacts()) {
            recap.append("\n- ").append(artifact.type()).append(": ").append(artifact.description());
        }
        return recap.toString();
    }

    private static String describe(Failure failure) {
        return "[" + failure.kind() + "] " + failure.toolName() + " " + failure.arguments() + ": " + failure.message();
    }
}
