package com.usdtgate.domain;

import lombok.RequiredArgsConstructor;
import org.bson.types.Decimal128;
import org.springframework.data.mongodb.core.FindAndModifyOptions;
import org.springframework.data.mongodb.core.MongoTemplate;
import org.springframework.data.mongodb.core.query.Query;
import org.springframework.data.mongodb.core.query.Update;
import org.springframework.stereotype.Repository;

import java.math.BigDecimal;
import java.time.Instant;

import static org.springframework.data.mongodb.core.query.Criteria.where;

/**
 * MongoTemplate-backed upserts for wallet_addresses.
 */
@Repository
@RequiredArgsConstructor
public class WalletAddressRepositoryImpl implements WalletAddressRepositoryCustom {

    private final MongoTemplate mongoTemplate;

    @Override
    public WalletAddress registerIfAbsent(String userId, String walletAddress, String label, Instant now) {
        Update update = new Update()
                .setOnInsert("userId", userId)
                .setOnInsert("walletAddress", walletAddress)
                .setOnInsert("verified", false)
                .setOnInsert("label", label)
                .setOnInsert("firstUsedAt", now)
                .setOnInsert("paymentCount", 0L)
                .setOnInsert("totalAmountUsdt", new Decimal128(BigDecimal.ZERO));
        return mongoTemplate.findAndModify(byId(userId, walletAddress), update,
                FindAndModifyOptions.options().upsert(true).returnNew(true), WalletAddress.class);
    }

    @Override
    public WalletAddress recordPayment(String userId, String walletAddress, BigDecimal amountUsdt, Instant now) {
        Update update = new Update()
                .setOnInsert("userId", userId)
                .setOnInsert("walletAddress", walletAddress)
                .setOnInsert("verified", false)
                .setOnInsert("firstUsedAt", now)
                .set("lastUsedAt", now)
                .inc("paymentCount", 1L)
                .inc("totalAmountUsdt", new Decimal128(amountUsdt));
        return mongoTemplate.findAndModify(byId(userId, walletAddress), update,
                FindAndModifyOptions.options().upsert(true).returnNew(true), WalletAddress.class);
    }

    private static Query byId(String userId, String walletAddress) {
        return new Query(where("id").is(WalletAddress.idOf(userId, walletAddress)));
    }
}
