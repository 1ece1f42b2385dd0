package com.usdtgate.domain;

import lombok.RequiredArgsConstructor;
import org.bson.Document;
import org.bson.types.Decimal128;
import org.springframework.data.domain.Sort;
import org.springframework.data.mongodb.core.FindAndModifyOptions;
import org.springframework.data.mongodb.core.MongoTemplate;
import org.springframework.data.mongodb.core.aggregation.Aggregation;
import org.springframework.data.mongodb.core.aggregation.AggregationResults;
import org.springframework.data.mongodb.core.query.Criteria;
import org.springframework.data.mongodb.core.query.Query;
import org.springframework.data.mongodb.core.query.Update;
import org.springframework.stereotype.Repository;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.Collection;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;

import static org.springframework.data.mongodb.core.query.Criteria.where;

/**
 * MongoTemplate-backed custom operations for payments.
 */
@Repository
@RequiredArgsConstructor
public class PaymentRepositoryImpl implements PaymentRepositoryCustom {

    private final MongoTemplate mongoTemplate;

    @Override
    public Payment updateIfStatusIn(String paymentId, Collection<PaymentStatus> expectedCurrent, Update update,
                                    boolean requireActivation) {
        Criteria criteria = where("paymentId").is(paymentId).and("status").in(expectedCurrent);
        if (requireActivation) {
            criteria = criteria.orOperator(
                    where("subscriptionId").ne(null),
                    where("pointsTransactionId").ne(null));
        }
        return mongoTemplate.findAndModify(new Query(criteria), update,
                FindAndModifyOptions.options().returnNew(false), Payment.class);
    }

    @Override
    public Payment setLinkIfAbsent(String paymentId, PaymentType type, String field, String value, Instant now) {
        Query query = new Query(where("paymentId").is(paymentId)
                .and("paymentType").is(type)
                .and(field).is(null));
        Update update = new Update().set(field, value).set("updatedAt", now);
        return mongoTemplate.findAndModify(query, update,
                FindAndModifyOptions.options().returnNew(true), Payment.class);
    }

    @Override
    public List<Payment> search(String userId, PaymentType type, PaymentStatus status, int limit, int skip) {
        Query query = new Query();
        if (userId != null) {
            query.addCriteria(where("userId").is(userId));
        }
        if (type != null) {
            query.addCriteria(where("paymentType").is(type));
        }
        if (status != null) {
            query.addCriteria(where("status").is(status));
        }
        query.with(Sort.by(Sort.Direction.DESC, "createdAt")).skip(Math.max(0, skip)).limit(Math.max(1, limit));
        return mongoTemplate.find(query, Payment.class);
    }

    @Override
    public List<String> findTransactionHashesCreatedSince(Instant since) {
        Query query = new Query(where("createdAt").gte(since).and("transactionHash").ne(null));
        return mongoTemplate.findDistinct(query, "transactionHash", Payment.class, String.class);
    }

    @Override
    public Map<PaymentStatus, Long> countByStatus() {
        Aggregation aggregation = Aggregation.newAggregation(
                Aggregation.group("status").count().as("count"));
        AggregationResults<Document> results = mongoTemplate.aggregate(aggregation, Payment.class, Document.class);
        Map<PaymentStatus, Long> counts = new EnumMap<>(PaymentStatus.class);
        for (PaymentStatus status : PaymentStatus.values()) {
            counts.put(status, 0L);
        }
        for (Document row : results.getMappedResults()) {
            Object id = row.get("_id");
            if (id == null) {
                continue;
            }
            counts.put(PaymentStatus.valueOf(id.toString()), ((Number) row.get("count")).longValue());
        }
        return counts;
    }

    @Override
    public BigDecimal sumAmountUsdtByStatus(PaymentStatus status) {
        Aggregation aggregation = Aggregation.newAggregation(
                Aggregation.match(where("status").is(status)),
                Aggregation.group().sum("amountUsdt").as("total"));
        Document row = mongoTemplate.aggregate(aggregation, Payment.class, Document.class).getUniqueMappedResult();
        if (row == null || row.get("total") == null) {
            return BigDecimal.ZERO;
        }
        Object total = row.get("total");
        if (total instanceof Decimal128 d) {
            return d.bigDecimalValue();
        }
        return new BigDecimal(total.toString());
    }
}
