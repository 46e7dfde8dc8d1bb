package com.eainde.graphagent.tools;

import com.eainde.graphagent.error.ErrorKind;
import com.eainde.graphagent.error.ErrorMessages;
import com.eainde.graphagent.error.GraphAgentException;
import com.eainde.graphagent.model.ExecutionResult;
import com.eainde.graphagent.model.ToolSignature;
import lombok.extern.log4j.Log4j2;

import java.time.Duration;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.Executor;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * Runs a {@link ToolSignature} and turns every outcome into an {@link ExecutionResult}.
 *
 * <h3>Retry policy</h3>
 * <ul>
 * <li>validation, not-found, constraint, unknown tool: {@code VALIDATION_ERROR}, retryable</li>
 * <li>timeout, transient store failure: {@code EXECUTION_ERROR}, retryable</li>
 * <li>query and other backend failures: {@code EXECUTION_ERROR}, not retryable</li>
 * </ul>
 */
@Log4j2
public class ToolExecutor {

    private final ToolRegistry registry;
    private final Executor executor;
    private final Duration timeout;

    public ToolExecutor(ToolRegistry registry, Executor executor, Duration timeout) {
        this.registry = registry;
        this.executor = executor;
        this.timeout = timeout;
    }

    public ExecutionResult execute(ToolSignature signature) {
        String toolName = signature.toolName();
        Tool tool;
        try {
            tool = registry.get(toolName);
            tool.schema().validate(signature.arguments());
        } catch (GraphAgentException e) {
            log.warn("Rejected call to {}: {}", toolName, e.getMessage());
            return ExecutionResult.validationError(toolName, e.getKind(), ErrorMessages.humanReadable(e));
        }

        long start = System.currentTimeMillis();
        CompletableFuture<Map<String, Object>> call =
                CompletableFuture.supplyAsync(() -> tool.execute(signature.arguments()), executor);
        try {
            Map<String, Object> payload = call.get(timeout.toMillis(), TimeUnit.MILLISECONDS);
            log.info("Tool {} succeeded in {}ms", toolName, System.currentTimeMillis() - start);
            return ExecutionResult.success(toolName, payload);
        } catch (TimeoutException e) {
            call.cancel(true);
            log.warn("Tool {} timed out after {}", toolName, timeout);
            return ExecutionResult.executionError(toolName, ErrorKind.TIMEOUT, ErrorMessages.humanReadable(e), true);
        } catch (ExecutionException e) {
            return fromFailure(toolName, e.getCause() != null ? e.getCause() : e);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            call.cancel(true);
            return ExecutionResult.executionError(toolName, ErrorKind.TRANSIENT, "Tool call was interrupted", true);
        }
    }

    private ExecutionResult fromFailure(String toolName, Throwable cause) {
        ErrorKind kind = ErrorMessages.kindOf(cause);
        String message = ErrorMessages.humanReadable(cause);
        switch (kind) {
            case VALIDATION, NOT_FOUND, CONSTRAINT_VIOLATION, TOOL_NOT_FOUND -> {
                log.warn("Tool {} rejected its input: {}", toolName, cause.getMessage());
                return ExecutionResult.validationError(toolName, kind, message);
            }
            case TIMEOUT, TRANSIENT -> {
                log.warn("Tool {} failed transiently: {}", toolName, cause.getMessage());
                return ExecutionResult.executionError(toolName, kind, message, true);
            }
            default -> {
                log.error("Tool {} failed", toolName, cause);
                return ExecutionResult.executionError(toolName, kind, message, false);
            }
        }
    }
}
