package com.usdtgate.chain;

import java.math.BigDecimal;

/**
 * A transfer found by {@link ChainReader#findTransfer}.
 */
public record TransferMatch(
        String transactionHash,
        String fromAddress,
        String toAddress,
        BigDecimal amount,
        long blockNumber,
        long confirmations
) {
}
