package com.usdtgate.domain;

import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;
import org.springframework.data.annotation.Id;
import org.springframework.data.mongodb.core.index.CompoundIndex;
import org.springframework.data.mongodb.core.mapping.Document;

import java.math.BigDecimal;
import java.time.Instant;

/**
 * Per-user sender wallet usage statistics. Id is {@code userId:walletAddress}.
 */
@Document(collection = "wallet_addresses")
@CompoundIndex(name = "user_wallet", def = "{'userId': 1, 'walletAddress': 1}", unique = true)
@NoArgsConstructor
@Getter
@Setter
@EqualsAndHashCode(onlyExplicitlyIncluded = true)
public class WalletAddress {

    @Id
    @EqualsAndHashCode.Include
    private String id;
    private String userId;
    private String walletAddress;
    private boolean verified;
    private String label;
    private Instant firstUsedAt;
    private Instant lastUsedAt;
    private long paymentCount;
    private BigDecimal totalAmountUsdt;

    public static String idOf(String userId, String walletAddress) {
        return userId + ":" + walletAddress;
    }
}
