package org.nowstart.stratagem.repository;

import java.time.Instant;
import java.util.List;
import java.util.Map;
import org.nowstart.stratagem.data.type.NodeExecutionState;
import org.nowstart.stratagem.data.type.SessionStatus;
import org.nowstart.stratagem.pipeline.HumanConfirmation;
import org.nowstart.stratagem.pipeline.PipelineIssue;
import org.nowstart.stratagem.strategy.BacktestMetrics;
import org.nowstart.stratagem.strategy.StrategySpec;
import org.nowstart.stratagem.strategy.Trade;
import org.nowstart.stratagem.strategy.ValidationResult;

/**
 * Persisted form of a pipeline state. Price series, feature frame and backtest run are left out.
 */
public record CheckpointRecord(
        int version,
        String sessionId,
        String stepCursor,
        SessionStatus status,
        Payload payload,
        List<PipelineIssue> errors,
        List<PipelineIssue> warnings,
        Map<String, Integer> retryCounts,
        Map<String, NodeExecutionState> nodeExecutions,
        HumanConfirmation pendingInput,
        Instant createdAt,
        Instant updatedAt
) {

    public static final int CURRENT_VERSION = 1;

    public record Payload(
            String userText,
            String model,
            boolean confirmed,
            StrategySpec spec,
            String interpretation,
            ValidationResult validationResult,
            ValidationResult dataValidationResult,
            BacktestMetrics metrics,
            List<Trade> trades,
            String explanation
    ) {
    }
}
