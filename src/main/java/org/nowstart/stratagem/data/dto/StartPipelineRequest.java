package org.nowstart.stratagem.data.dto;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Size;

public record StartPipelineRequest(
        @NotBlank(message = "userText is required")
        @Size(max = 4000, message = "userText must be at most 4000 characters")
        String userText,
        String model,
        @Size(max = 128, message = "sessionId must be at most 128 characters")
        String sessionId,
        boolean autoConfirm
) {
}
