package org.nowstart.stratagem.pipeline;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import lombok.Getter;
import org.nowstart.stratagem.data.exception.StateConsistencyException;
import org.nowstart.stratagem.data.type.NodeExecutionState;
import org.nowstart.stratagem.data.type.NodeName;
import org.nowstart.stratagem.data.type.SessionStatus;

/**
 * Shared state of one pipeline session. Only the engine mutates it; once the status is terminal every mutator throws.
 */
@Getter
public class PipelineState {

    private final String sessionId;
    private final PipelinePayload payload;
    private final List<PipelineIssue> errors;
    private final List<PipelineIssue> warnings;
    private final Map<NodeName, Integer> retryCounts;
    private final Map<NodeName, NodeExecutionState> nodeExecutions;
    private final Instant createdAt;

    private NodeName stepCursor;
    private SessionStatus status;
    private HumanConfirmation pendingInput;
    private Instant updatedAt;

    // final error of the last hard failure; never checkpointed
    private Throwable failureCause;

    private PipelineState(
            String sessionId,
            NodeName stepCursor,
            SessionStatus status,
            PipelinePayload payload,
            List<PipelineIssue> errors,
            List<PipelineIssue> warnings,
            Map<NodeName, Integer> retryCounts,
            Map<NodeName, NodeExecutionState> nodeExecutions,
            HumanConfirmation pendingInput,
            Instant createdAt,
            Instant updatedAt
    ) {
        this.sessionId = sessionId;
        this.stepCursor = stepCursor;
        this.status = status;
        this.payload = payload;
        this.errors = new ArrayList<>(errors);
        this.warnings = new ArrayList<>(warnings);
        this.retryCounts = new EnumMap<>(NodeName.class);
        this.retryCounts.putAll(retryCounts);
        this.nodeExecutions = new EnumMap<>(NodeName.class);
        this.nodeExecutions.putAll(nodeExecutions);
        this.pendingInput = pendingInput;
        this.createdAt = createdAt;
        this.updatedAt = updatedAt;
        if (status.isTerminal()) {
            payload.seal();
        }
    }

    static PipelineState create(String sessionId, String userText, String model, Instant now) {
        return new PipelineState(
                sessionId,
                null,
                SessionStatus.RUNNING,
                new PipelinePayload(userText, model),
                List.of(),
                List.of(),
                Map.of(),
                Map.of(),
                null,
                now,
                now
        );
    }

    public static PipelineState restore(
            String sessionId,
            NodeName stepCursor,
            SessionStatus status,
            PipelinePayload payload,
            List<PipelineIssue> errors,
            List<PipelineIssue> warnings,
            Map<NodeName, Integer> retryCounts,
            Map<NodeName, NodeExecutionState> nodeExecutions,
            HumanConfirmation pendingInput,
            Instant createdAt,
            Instant updatedAt
    ) {
        return new PipelineState(sessionId, stepCursor, status, payload, errors, warnings,
                retryCounts, nodeExecutions, pendingInput, createdAt, updatedAt);
    }

    public List<PipelineIssue> getErrors() {
        return Collections.unmodifiableList(errors);
    }

    public List<PipelineIssue> getWarnings() {
        return Collections.unmodifiableList(warnings);
    }

    public Map<NodeName, Integer> getRetryCounts() {
        return Collections.unmodifiableMap(retryCounts);
    }

    public Map<NodeName, NodeExecutionState> getNodeExecutions() {
        return Collections.unmodifiableMap(nodeExecutions);
    }

    public int retryCount(NodeName node) {
        return retryCounts.getOrDefault(node, 0);
    }

    public boolean hasErrorsFrom(NodeName node) {
        return errors.stream().anyMatch(issue -> issue.step() == node);
    }

    public boolean isTerminal() {
        return status.isTerminal();
    }

    void advanceCursor(NodeName node, Instant now) {
        ensureMutable();
        this.stepCursor = node;
        touch(now);
    }

    void updateStatus(SessionStatus status, Instant now) {
        ensureMutable();
        this.status = status;
        touch(now);
        if (status.isTerminal()) {
            payload.seal();
        }
    }

    void addError(NodeName node, String message, Instant now) {
        ensureMutable();
        errors.add(new PipelineIssue(node, message, now));
        touch(now);
    }

    void addWarning(NodeName node, String message, Instant now) {
        ensureMutable();
        warnings.add(new PipelineIssue(node, message, now));
        touch(now);
    }

    void recordAttempt(NodeName node) {
        ensureMutable();
        retryCounts.merge(node, 1, Integer::sum);
    }

    void resetRetryCount(NodeName node) {
        ensureMutable();
        retryCounts.remove(node);
    }

    void markNode(NodeName node, NodeExecutionState executionState) {
        ensureMutable();
        nodeExecutions.put(node, executionState);
    }

    void updatePendingInput(HumanConfirmation confirmation) {
        ensureMutable();
        this.pendingInput = confirmation;
    }

    void updateFailureCause(Throwable cause) {
        ensureMutable();
        this.failureCause = cause;
    }

    private void touch(Instant now) {
        this.updatedAt = now;
    }

    private void ensureMutable() {
        if (status.isTerminal()) {
            throw new StateConsistencyException("Session is already " + status + ". sessionId=" + sessionId);
        }
    }
}
