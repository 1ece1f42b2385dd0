package com.usdtgate.api.dto;

import jakarta.validation.constraints.NotBlank;

public record ManualConfirmRequest(
        @NotBlank(message = "INVALID_ADMIN")
        String adminId,
        String notes
) {
}
