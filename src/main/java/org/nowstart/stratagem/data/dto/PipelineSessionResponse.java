package org.nowstart.stratagem.data.dto;

import java.time.Instant;
import java.util.List;
import java.util.Map;
import org.nowstart.stratagem.data.type.SessionStatus;
import org.nowstart.stratagem.pipeline.PipelineIssue;
import org.nowstart.stratagem.strategy.BacktestMetrics;
import org.nowstart.stratagem.strategy.StrategySpec;
import org.nowstart.stratagem.strategy.Trade;
import org.nowstart.stratagem.strategy.ValidationResult;

public record PipelineSessionResponse(
        String sessionId,
        SessionStatus status,
        String stepCursor,
        boolean awaitingInput,
        String userText,
        String model,
        boolean confirmed,
        StrategySpec spec,
        String interpretation,
        ValidationResult validationResult,
        ValidationResult dataValidationResult,
        BacktestMetrics metrics,
        List<Trade> trades,
        String explanation,
        List<PipelineIssue> errors,
        List<PipelineIssue> warnings,
        Map<String, Integer> retryCounts,
        Instant createdAt,
        Instant updatedAt
) {
}
