package com.usdtgate.domain;

import java.math.BigDecimal;
import java.time.Instant;

/**
 * Upserts on wallet_addresses.
 */
public interface WalletAddressRepositoryCustom {

    /** Inserts the wallet if absent; an existing entry is returned unchanged. */
    WalletAddress registerIfAbsent(String userId, String walletAddress, String label, Instant now);

    /** Upserts the wallet and adds one payment of {@code amountUsdt} to its counters. */
    WalletAddress recordPayment(String userId, String walletAddress, BigDecimal amountUsdt, Instant now);
}
