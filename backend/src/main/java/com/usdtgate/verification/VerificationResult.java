package com.usdtgate.verification;

import java.math.BigDecimal;

/**
 * Verdict of {@link TransferVerifier}. {@code details} is present only when valid.
 */
public record VerificationResult(boolean valid, String reason, TransferDetails details) {

    public static VerificationResult valid(TransferDetails details) {
        return new VerificationResult(true, "ok", details);
    }

    public static VerificationResult invalid(String reason) {
        return new VerificationResult(false, reason, null);
    }

    /**
     * Facts recorded on the payment once a transfer checks out.
     */
    public record TransferDetails(
            String transactionHash,
            String fromAddress,
            String toAddress,
            BigDecimal amountUsdt,
            long blockNumber,
            Long gasUsed
    ) {
    }
}
