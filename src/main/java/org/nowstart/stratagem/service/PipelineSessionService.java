package org.nowstart.stratagem.service;

import java.util.LinkedHashMap;
import java.util.Map;
import lombok.RequiredArgsConstructor;
import org.nowstart.stratagem.data.dto.ConfirmationRequest;
import org.nowstart.stratagem.data.dto.PipelineSessionResponse;
import org.nowstart.stratagem.data.dto.StartPipelineRequest;
import org.nowstart.stratagem.data.exception.SessionNotFoundException;
import org.nowstart.stratagem.data.type.SessionStatus;
import org.nowstart.stratagem.pipeline.HumanConfirmation;
import org.nowstart.stratagem.pipeline.PipelineEngine;
import org.nowstart.stratagem.pipeline.PipelineInput;
import org.nowstart.stratagem.pipeline.PipelinePayload;
import org.nowstart.stratagem.pipeline.PipelineState;
import org.springframework.stereotype.Service;

@Service
@RequiredArgsConstructor
public class PipelineSessionService {

    private final PipelineEngine pipelineEngine;

    public PipelineSessionResponse start(StartPipelineRequest request) {
        PipelineState state = pipelineEngine.start(new PipelineInput(
                request.userText(),
                request.model(),
                request.sessionId(),
                request.autoConfirm()
        ));
        return toResponse(state);
    }

    public PipelineSessionResponse getSession(String sessionId) {
        return pipelineEngine.find(sessionId)
                .map(this::toResponse)
                .orElseThrow(() -> new SessionNotFoundException(sessionId));
    }

    public PipelineSessionResponse confirm(String sessionId, ConfirmationRequest request) {
        HumanConfirmation confirmation = new HumanConfirmation(Boolean.TRUE.equals(request.confirmed()), request.editedInput());
        return toResponse(pipelineEngine.resume(sessionId, confirmation));
    }

    public PipelineSessionResponse recover(String sessionId) {
        return toResponse(pipelineEngine.recover(sessionId));
    }

    public PipelineSessionResponse cancel(String sessionId) {
        return toResponse(pipelineEngine.cancel(sessionId));
    }

    public void delete(String sessionId) {
        pipelineEngine.cleanup(sessionId);
    }

    PipelineSessionResponse toResponse(PipelineState state) {
        PipelinePayload payload = state.getPayload();
        Map<String, Integer> retryCounts = new LinkedHashMap<>();
        state.getRetryCounts().forEach((node, count) -> retryCounts.put(node.id(), count));

        return new PipelineSessionResponse(
                state.getSessionId(),
                state.getStatus(),
                state.getStepCursor() == null ? null : state.getStepCursor().id(),
                state.getStatus() == SessionStatus.AWAITING_INPUT,
                payload.getUserText(),
                payload.getModel(),
                payload.isConfirmed(),
                payload.getSpec(),
                payload.getInterpretation(),
                payload.getValidationResult(),
                payload.getDataValidationResult(),
                payload.getMetrics(),
                payload.getTrades(),
                payload.getExplanation(),
                state.getErrors(),
                state.getWarnings(),
                retryCounts,
                state.getCreatedAt(),
                state.getUpdatedAt()
        );
    }
}
