package org.nowstart.stratagem.pipeline;

/**
 * Start request. {@code sessionId} may be null; {@code autoConfirm} runs past the confirmation point without parking.
 */
public record PipelineInput(String userText, String model, String sessionId, boolean autoConfirm) {

    public static PipelineInput of(String userText, String model) {
        return new PipelineInput(userText, model, null, false);
    }
}
