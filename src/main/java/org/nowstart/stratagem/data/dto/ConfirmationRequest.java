package org.nowstart.stratagem.data.dto;

import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Size;

public record ConfirmationRequest(
        @NotNull(message = "confirmed is required")
        Boolean confirmed,
        @Size(max = 4000, message = "editedInput must be at most 4000 characters")
        String editedInput
) {
}
