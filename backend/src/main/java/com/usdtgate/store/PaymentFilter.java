package com.usdtgate.store;

import com.usdtgate.domain.PaymentStatus;
import com.usdtgate.domain.PaymentType;

/**
 * Admin listing filter. Null criteria match everything.
 */
public record PaymentFilter(String userId, PaymentType paymentType, PaymentStatus status, int limit, int skip) {

    public static final int MAX_LIMIT = 500;

    public PaymentFilter {
        limit = limit <= 0 ? 50 : Math.min(limit, MAX_LIMIT);
        skip = Math.max(0, skip);
    }
}
