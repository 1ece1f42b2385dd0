package com.usdtgate.chain;

import java.math.BigDecimal;

/**
 * Read-only view of the BEP20 token on BSC.
 * Reads that can legitimately find nothing return {@link ChainResult}; the rest throw
 * {@link ChainUnavailableException} when the chain cannot be reached.
 */
public interface ChainReader {

    ChainResult<ChainTransaction> getTransaction(String txHash);

    ChainResult<TransactionReceipt> getReceipt(String txHash);

    /**
     * {@code currentBlock - receiptBlock + 1}; NOT_FOUND while the transaction is not mined.
     */
    ChainResult<Long> getConfirmations(String txHash);

    ChainResult<Boolean> isTransactionSuccessful(String txHash);

    /**
     * Scans the most recent {@code maxBlocksToScan} blocks for a matching token transfer; newest match wins.
     */
    ChainResult<TransferMatch> findTransfer(TransferQuery query);

    /** Token balance of {@code address}. */
    BigDecimal getBalance(String address);

    long getCurrentBlock();
}
