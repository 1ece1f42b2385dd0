package com.usdtgate.api.dto;

import jakarta.validation.constraints.NotBlank;

public record SubmitTransactionRequest(
        @NotBlank(message = "INVALID_TRANSACTION_HASH")
        String transactionHash
) {
}
