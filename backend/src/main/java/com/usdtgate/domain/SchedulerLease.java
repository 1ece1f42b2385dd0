package com.usdtgate.domain;

import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;
import org.springframework.data.annotation.Id;
import org.springframework.data.mongodb.core.mapping.Document;

import java.time.Instant;

/**
 * Leader lease for a named background job; at most one owner holds an unexpired lease.
 */
@Document(collection = "scheduler_leases")
@NoArgsConstructor
@Getter
@Setter
public class SchedulerLease {

    @Id
    private String name;
    private String owner;
    private Instant acquiredAt;
    private Instant expiresAt;
}
