package com.usdtgate.chain;

import java.math.BigDecimal;
import java.util.Set;

/**
 * Search for a recent token transfer to {@code toAddress} of roughly {@code expectedAmount}.
 *
 * @param fromAddress            sender filter; null matches any sender
 * @param toleranceFraction      relative tolerance, e.g. 0.01 for ±1%
 * @param excludedTransactionHashes hashes already claimed by other payments (lowercase)
 */
public record TransferQuery(
        String fromAddress,
        String toAddress,
        BigDecimal expectedAmount,
        BigDecimal toleranceFraction,
        int maxBlocksToScan,
        Set<String> excludedTransactionHashes
) {

    public TransferQuery {
        excludedTransactionHashes = excludedTransactionHashes != null ? Set.copyOf(excludedTransactionHashes) : Set.of();
    }
}
