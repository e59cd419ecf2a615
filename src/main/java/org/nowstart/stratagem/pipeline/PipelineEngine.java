package org.nowstart.stratagem.pipeline;

import java.time.Clock;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;
import lombok.extern.slf4j.Slf4j;
import org.nowstart.stratagem.data.exception.InvalidInputException;
import org.nowstart.stratagem.data.exception.SessionNotFoundException;
import org.nowstart.stratagem.data.exception.StateConsistencyException;
import org.nowstart.stratagem.data.property.PipelineProperties;
import org.nowstart.stratagem.data.type.NodeExecutionState;
import org.nowstart.stratagem.data.type.NodeName;
import org.nowstart.stratagem.data.type.RouteAction;
import org.nowstart.stratagem.data.type.SessionStatus;
import org.nowstart.stratagem.repository.CheckpointStore;
import org.springframework.stereotype.Service;

/**
 * Drives sessions node by node until the router suspends or terminates them, checkpointing at every stop.
 */
@Slf4j
@Service
public class PipelineEngine {

    static final String CANCELLED_MESSAGE = "Cancelled by user";

    private final Map<NodeName, PipelineNode> nodes = new EnumMap<>(NodeName.class);
    private final PipelineRouter router;
    private final CheckpointStore checkpointStore;
    private final RetryExecutor retryExecutor;
    private final Clock clock;
    private final PipelineProperties properties;
    private final SessionGuard sessionGuard = new SessionGuard();

    public PipelineEngine(
            List<PipelineNode> pipelineNodes,
            PipelineRouter router,
            CheckpointStore checkpointStore,
            RetryExecutor retryExecutor,
            Clock clock,
            PipelineProperties properties
    ) {
        for (PipelineNode node : pipelineNodes) {
            if (nodes.put(node.name(), node) != null) {
                throw new IllegalStateException("Duplicate pipeline node=" + node.name());
            }
        }
        for (NodeName name : NodeName.values()) {
            if (!nodes.containsKey(name)) {
                throw new IllegalStateException("Missing pipeline node=" + name);
            }
        }
        this.router = router;
        this.checkpointStore = checkpointStore;
        this.retryExecutor = retryExecutor;
        this.clock = clock;
        this.properties = properties;
    }

    public PipelineState start(PipelineInput input) {
        if (input.userText() == null || input.userText().isBlank()) {
            throw new InvalidInputException("Strategy description is required");
        }
        String sessionId = input.sessionId() == null || input.sessionId().isBlank()
                ? UUID.randomUUID().toString()
                : input.sessionId().trim();
        String model = input.model() == null || input.model().isBlank()
                ? properties.defaultModel()
                : input.model().trim();

        sessionGuard.acquire(sessionId);
        try {
            if (checkpointStore.exists(sessionId)) {
                throw new StateConsistencyException("Session already exists. sessionId=" + sessionId);
            }

            PipelineState state = PipelineState.create(sessionId, input.userText(), model, clock.instant());
            if (input.autoConfirm()) {
                state.updatePendingInput(HumanConfirmation.confirm());
            }
            checkpoint(state);
            log.info("event=pipeline_started session={} model={} auto_confirm={}", sessionId, model, input.autoConfirm());
            return drive(state, RouteDecision.goTo(NodeName.TRANSLATE));
        } finally {
            sessionGuard.release(sessionId);
        }
    }

    public PipelineState resume(String sessionId, HumanConfirmation confirmation) {
        sessionGuard.acquire(sessionId);
        try {
            PipelineState state = load(sessionId);
            if (state.getStatus() != SessionStatus.AWAITING_INPUT) {
                throw new StateConsistencyException(
                        "Session is not awaiting input. sessionId=" + sessionId + " status=" + state.getStatus());
            }

            state.updatePendingInput(confirmation);
            state.updateStatus(SessionStatus.RUNNING, clock.instant());
            log.info("event=pipeline_resumed session={} confirmed={} edited={}",
                    sessionId, confirmation.confirmed(), confirmation.hasEdits());

            RouteDecision decision = route(state.getStepCursor(), state, NodeOutcome.success());
            return drive(state, decision);
        } finally {
            sessionGuard.release(sessionId);
        }
    }

    /**
     * Continues a session whose process stopped mid-run. The node named by the cursor is replayed first.
     */
    public PipelineState recover(String sessionId) {
        sessionGuard.acquire(sessionId);
        try {
            PipelineState state = load(sessionId);
            if (state.getStatus() != SessionStatus.RUNNING) {
                throw new StateConsistencyException(
                        "Only running sessions can be recovered. sessionId=" + sessionId + " status=" + state.getStatus());
            }

            NodeName replay = state.getStepCursor() == null ? NodeName.TRANSLATE : state.getStepCursor();
            log.info("event=pipeline_recovering session={} replay={}", sessionId, replay);
            NodeOutcome outcome = executeNode(state, replay, false);
            return drive(state, route(replay, state, outcome));
        } finally {
            sessionGuard.release(sessionId);
        }
    }

    /**
     * Cancels at a node boundary. A session executing in this process is flagged and fails as soon as its current
     * node returns; a parked or stalled session is failed right away.
     */
    public PipelineState cancel(String sessionId) {
        while (!sessionGuard.tryAcquire(sessionId)) {
            if (sessionGuard.requestCancel(sessionId)) {
                log.info("event=pipeline_cancel_requested session={}", sessionId);
                return load(sessionId);
            }
        }

        try {
            PipelineState state = load(sessionId);
            if (state.isTerminal()) {
                throw new StateConsistencyException(
                        "Session already finished. sessionId=" + sessionId + " status=" + state.getStatus());
            }
            failCancelled(state);
            checkpoint(state);
            return state;
        } finally {
            sessionGuard.release(sessionId);
        }
    }

    public Optional<PipelineState> find(String sessionId) {
        return checkpointStore.load(sessionId);
    }

    public void cleanup(String sessionId) {
        sessionGuard.acquire(sessionId);
        try {
            if (!checkpointStore.exists(sessionId)) {
                throw new SessionNotFoundException(sessionId);
            }
            checkpointStore.delete(sessionId);
            log.info("event=pipeline_cleaned_up session={}", sessionId);
        } finally {
            sessionGuard.release(sessionId);
        }
    }

    private PipelineState drive(PipelineState state, RouteDecision first) {
        RouteDecision decision = first;
        while (true) {
            // checked before any decision is applied, so a cancel that arrived during the last node wins
            if (sessionGuard.isCancelRequested(state.getSessionId())) {
                failCancelled(state);
                checkpoint(state);
                return state;
            }
            if (decision.action() == RouteAction.SUSPEND) {
                state.updateStatus(SessionStatus.AWAITING_INPUT, clock.instant());
                checkpoint(state);
                log.info("event=pipeline_suspended session={} cursor={} reason={}",
                        state.getSessionId(), state.getStepCursor(), decision.reason());
                return state;
            }
            if (decision.action() == RouteAction.TERMINATE) {
                state.updateStatus(decision.finalStatus(), clock.instant());
                checkpoint(state);
                log.info("event=pipeline_finished session={} status={} cursor={} errors={} warnings={}",
                        state.getSessionId(),
                        state.getStatus(),
                        state.getStepCursor(),
                        state.getErrors().size(),
                        state.getWarnings().size());
                return state;
            }

            NodeName node = decision.target();
            NodeOutcome outcome = executeNode(state, node, true);
            decision = route(node, state, outcome);
        }
    }

    private RouteDecision route(NodeName node, PipelineState state, NodeOutcome outcome) {
        RouteDecision decision = router.next(node, state, outcome);
        HumanConfirmation pending = state.getPendingInput();
        if (pending == null || !router.isSuspensionPoint(node)) {
            return decision;
        }

        // the confirmation is consumed by the first decision taken out of the suspension point
        if (decision.action() == RouteAction.GOTO) {
            if (pending.confirmed()) {
                state.getPayload().setConfirmed(true);
            } else if (pending.hasEdits()) {
                state.getPayload().setUserText(pending.editedInput());
            }
        }
        state.updatePendingInput(null);
        return decision;
    }

    private NodeOutcome executeNode(PipelineState state, NodeName node, boolean fresh) {
        if (fresh) {
            state.resetRetryCount(node);
        }
        state.markNode(node, NodeExecutionState.RUNNING);
        log.info("event=pipeline_node_started session={} node={} fresh={}", state.getSessionId(), node, fresh);

        NodeOutcome outcome = invoke(state, nodes.get(node));
        record(state, node, outcome, !fresh);

        log.info("event=pipeline_node_finished session={} node={} result={} attempts={}",
                state.getSessionId(), node, outcome.result(), state.retryCount(node));
        if (properties.checkpointEveryNode()) {
            checkpoint(state);
        }
        return outcome;
    }

    private NodeOutcome invoke(PipelineState state, PipelineNode node) {
        NodeOutcome missing = ensurePrerequisites(state, node);
        if (missing != null) {
            return missing;
        }

        PipelinePayload payload = state.getPayload();
        payload.enterNode(node.name());
        try {
            return node.run(state, new NodeContext(node.name(), state, retryExecutor));
        } catch (StateConsistencyException e) {
            throw e;
        } catch (RuntimeException e) {
            return NodeOutcome.hardFailure(node.name() + " failed: " + e.getMessage(), e);
        } finally {
            payload.exitNode();
        }
    }

    // computed artifacts are not checkpointed; after a recovery their producers run again without moving the cursor
    private NodeOutcome ensurePrerequisites(PipelineState state, PipelineNode node) {
        for (PayloadField field : node.requires()) {
            if (state.getPayload().has(field)) {
                continue;
            }
            if (field.persistent() || field.engineOwned()) {
                return NodeOutcome.hardFailure(
                        "Cannot run " + node.name() + ": " + field + " is missing", null);
            }

            log.info("event=pipeline_artifact_rebuild session={} node={} field={} producer={}",
                    state.getSessionId(), node.name(), field, field.owner());
            NodeOutcome rebuilt = invoke(state, nodes.get(field.owner()));
            if (rebuilt.isHardFailure() || !state.getPayload().has(field)) {
                String reason = rebuilt.errors().isEmpty() ? "no output" : rebuilt.errors().get(0);
                return NodeOutcome.hardFailure(
                        "Cannot run " + node.name() + ": rebuilding " + field + " failed: " + reason, rebuilt.cause());
            }
        }
        return null;
    }

    private void record(PipelineState state, NodeName node, NodeOutcome outcome, boolean replay) {
        state.markNode(node, outcome.result());
        for (String error : outcome.errors()) {
            if (!replay || !isRecorded(state.getErrors(), node, error)) {
                state.addError(node, error, clock.instant());
            }
        }
        for (String warning : outcome.warnings()) {
            // a replayed node reports what the lost run may already have recorded
            if (!replay || !isRecorded(state.getWarnings(), node, warning)) {
                state.addWarning(node, warning, clock.instant());
            }
        }

        if (outcome.isHardFailure()) {
            state.updateFailureCause(outcome.cause());
            log.warn("event=pipeline_node_failed session={} node={} errors={}",
                    state.getSessionId(), node, outcome.errors(), outcome.cause());
            return;
        }
        state.advanceCursor(node, clock.instant());
    }

    private static boolean isRecorded(List<PipelineIssue> issues, NodeName node, String message) {
        return issues.stream().anyMatch(issue -> issue.step() == node && issue.message().equals(message));
    }

    private void failCancelled(PipelineState state) {
        state.updatePendingInput(null);
        NodeName step = state.getStepCursor() == null ? NodeName.TRANSLATE : state.getStepCursor();
        state.addError(step, CANCELLED_MESSAGE, clock.instant());
        state.updateStatus(SessionStatus.FAILED, clock.instant());
        log.info("event=pipeline_cancelled session={} cursor={}", state.getSessionId(), state.getStepCursor());
    }

    private void checkpoint(PipelineState state) {
        checkpointStore.save(state.getSessionId(), state);
    }

    private PipelineState load(String sessionId) {
        return checkpointStore.load(sessionId)
                .orElseThrow(() -> new SessionNotFoundException(sessionId));
    }
}
