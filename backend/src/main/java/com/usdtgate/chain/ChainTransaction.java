package com.usdtgate.chain;

import java.math.BigInteger;

/**
 * Result of eth_getTransactionByHash. {@code blockNumber} is null while the transaction sits in the mempool.
 */
public record ChainTransaction(
        String hash,
        String from,
        String to,
        Long blockNumber,
        BigInteger value,
        String input
) {

    public boolean isMined() {
        return blockNumber != null;
    }
}
