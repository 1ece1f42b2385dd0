package com.usdtgate.domain;

import lombok.RequiredArgsConstructor;
import org.springframework.data.mongodb.core.FindAndModifyOptions;
import org.springframework.data.mongodb.core.MongoTemplate;
import org.springframework.data.mongodb.core.query.Query;
import org.springframework.data.mongodb.core.query.Update;
import org.springframework.stereotype.Repository;

import static org.springframework.data.mongodb.core.query.Criteria.where;

/**
 * MongoTemplate-backed updates for pending_transactions.
 */
@Repository
@RequiredArgsConstructor
public class PendingTransactionRepositoryImpl implements PendingTransactionRepositoryCustom {

    private final MongoTemplate mongoTemplate;

    @Override
    public PendingTransaction updateByPaymentId(String paymentId, Update update) {
        return mongoTemplate.findAndModify(new Query(where("paymentId").is(paymentId)), update,
                FindAndModifyOptions.options().returnNew(true), PendingTransaction.class);
    }
}
