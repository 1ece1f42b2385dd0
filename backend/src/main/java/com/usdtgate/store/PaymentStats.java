package com.usdtgate.store;

import com.usdtgate.domain.PaymentStatus;

import java.math.BigDecimal;
import java.util.Map;

public record PaymentStats(Map<PaymentStatus, Long> countsByStatus, long totalPayments, BigDecimal completedAmountUsdt) {
}
