package com.usdtgate.scheduler;

import com.usdtgate.domain.SchedulerLease;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DuplicateKeyException;
import org.springframework.data.mongodb.core.FindAndModifyOptions;
import org.springframework.data.mongodb.core.MongoTemplate;
import org.springframework.data.mongodb.core.query.Criteria;
import org.springframework.data.mongodb.core.query.Query;
import org.springframework.data.mongodb.core.query.Update;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.UUID;

import static org.springframework.data.mongodb.core.query.Criteria.where;

/**
 * Mongo-backed leader lease so that only one replica sweeps at a time. Acquire is one conditional
 * upsert: it matches when this node already owns the lease or the lease has expired.
 * A lost insert race surfaces as a duplicate key and means another node holds the lease.
 */
@Component
@Slf4j
public class SchedulerLeaseManager {

    private final MongoTemplate mongoTemplate;
    private final Clock clock;
    private final String owner;

    public SchedulerLeaseManager(MongoTemplate mongoTemplate, Clock clock) {
        this(mongoTemplate, clock, "node-" + UUID.randomUUID());
    }

    SchedulerLeaseManager(MongoTemplate mongoTemplate, Clock clock, String owner) {
        this.mongoTemplate = mongoTemplate;
        this.clock = clock;
        this.owner = owner;
    }

    public String getOwner() {
        return owner;
    }

    public boolean tryAcquire(String name, Duration ttl) {
        Instant now = clock.instant();
        Query query = new Query(where("_id").is(name)
                .orOperator(where("owner").is(owner), where("expiresAt").lte(now)));
        Update update = new Update()
                .set("owner", owner)
                .set("expiresAt", now.plus(ttl))
                .setOnInsert("acquiredAt", now);
        try {
            SchedulerLease lease = mongoTemplate.findAndModify(query, update,
                    FindAndModifyOptions.options().upsert(true).returnNew(true), SchedulerLease.class);
            return lease != null && owner.equals(lease.getOwner());
        } catch (DuplicateKeyException e) {
            log.debug("Lease {} held by another node", name);
            return false;
        }
    }

    /**
     * Extends a lease this node still holds. Unlike {@link #tryAcquire} it never takes over an expired
     * lease, so a false result means the lease may already belong to another node.
     */
    public boolean renew(String name, Duration ttl) {
        Instant now = clock.instant();
        Query query = new Query(where("_id").is(name).and("owner").is(owner).and("expiresAt").gt(now));
        boolean renewed = mongoTemplate.updateFirst(query, new Update().set("expiresAt", now.plus(ttl)),
                SchedulerLease.class).getMatchedCount() > 0;
        if (!renewed) {
            log.warn("Lease {} could not be renewed by {}", name, owner);
        }
        return renewed;
    }

    public void release(String name) {
        mongoTemplate.remove(new Query(Criteria.where("_id").is(name).and("owner").is(owner)), SchedulerLease.class);
    }
}
