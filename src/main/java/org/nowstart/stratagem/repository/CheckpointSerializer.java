package org.nowstart.stratagem.repository;

import com.fasterxml.jackson.core.JsonProcessingException;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import org.nowstart.stratagem.data.type.NodeExecutionState;
import org.nowstart.stratagem.data.type.NodeName;
import org.nowstart.stratagem.pipeline.PipelinePayload;
import org.nowstart.stratagem.pipeline.PipelineState;
import org.nowstart.stratagem.strategy.StrategyJson;
import org.springframework.stereotype.Component;

/**
 * Converts pipeline state to and from checkpoint JSON.
 */
@Component
public class CheckpointSerializer {

    public String serialize(PipelineState state) {
        try {
            return StrategyJson.MAPPER.writeValueAsString(toRecord(state));
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Failed to serialize checkpoint. sessionId=" + state.getSessionId(), e);
        }
    }

    public PipelineState deserialize(String json) {
        CheckpointRecord record;
        try {
            record = StrategyJson.MAPPER.readValue(json, CheckpointRecord.class);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Failed to read checkpoint: " + e.getOriginalMessage(), e);
        }
        return fromRecord(record);
    }

    CheckpointRecord toRecord(PipelineState state) {
        PipelinePayload payload = state.getPayload();
        Map<String, Integer> retryCounts = new LinkedHashMap<>();
        state.getRetryCounts().forEach((node, count) -> retryCounts.put(node.id(), count));
        Map<String, NodeExecutionState> nodeExecutions = new LinkedHashMap<>();
        state.getNodeExecutions().forEach((node, result) -> nodeExecutions.put(node.id(), result));

        return new CheckpointRecord(
                CheckpointRecord.CURRENT_VERSION,
                state.getSessionId(),
                state.getStepCursor() == null ? null : state.getStepCursor().id(),
                state.getStatus(),
                new CheckpointRecord.Payload(
                        payload.getUserText(),
                        payload.getModel(),
                        payload.isConfirmed(),
                        payload.getSpec(),
                        payload.getInterpretation(),
                        payload.getValidationResult(),
                        payload.getDataValidationResult(),
                        payload.getMetrics(),
                        payload.getTrades(),
                        payload.getExplanation()
                ),
                state.getErrors(),
                state.getWarnings(),
                retryCounts,
                nodeExecutions,
                state.getPendingInput(),
                state.getCreatedAt(),
                state.getUpdatedAt()
        );
    }

    PipelineState fromRecord(CheckpointRecord record) {
        if (record.version() != CheckpointRecord.CURRENT_VERSION) {
            throw new IllegalStateException("Unsupported checkpoint version=" + record.version());
        }

        CheckpointRecord.Payload payload = record.payload();
        Map<NodeName, Integer> retryCounts = new LinkedHashMap<>();
        if (record.retryCounts() != null) {
            record.retryCounts().forEach((node, count) -> retryCounts.put(NodeName.fromId(node), count));
        }
        Map<NodeName, NodeExecutionState> nodeExecutions = new LinkedHashMap<>();
        if (record.nodeExecutions() != null) {
            record.nodeExecutions().forEach((node, result) -> nodeExecutions.put(NodeName.fromId(node), result));
        }

        return PipelineState.restore(
                record.sessionId(),
                record.stepCursor() == null ? null : NodeName.fromId(record.stepCursor()),
                record.status(),
                PipelinePayload.restore(
                        payload.userText(),
                        payload.model(),
                        payload.confirmed(),
                        payload.spec(),
                        payload.interpretation(),
                        payload.validationResult(),
                        payload.dataValidationResult(),
                        payload.metrics(),
                        payload.trades(),
                        payload.explanation()
                ),
                record.errors() == null ? List.of() : record.errors(),
                record.warnings() == null ? List.of() : record.warnings(),
                retryCounts,
                nodeExecutions,
                record.pendingInput(),
                record.createdAt(),
                record.updatedAt()
        );
    }
}
