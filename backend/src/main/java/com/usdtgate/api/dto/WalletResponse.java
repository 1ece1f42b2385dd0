package com.usdtgate.api.dto;

import com.usdtgate.domain.WalletAddress;

import java.math.BigDecimal;
import java.time.Instant;

public record WalletResponse(
        String walletAddress,
        String label,
        boolean verified,
        long paymentCount,
        BigDecimal totalAmountUsdt,
        Instant firstUsedAt,
        Instant lastUsedAt
) {

    public static WalletResponse from(WalletAddress w) {
        return new WalletResponse(w.getWalletAddress(), w.getLabel(), w.isVerified(), w.getPaymentCount(),
                w.getTotalAmountUsdt(), w.getFirstUsedAt(), w.getLastUsedAt());
    }
}
