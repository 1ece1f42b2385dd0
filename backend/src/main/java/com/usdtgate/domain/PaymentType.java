package com.usdtgate.domain;

public enum PaymentType {
    SUBSCRIPTION,
    POINTS
}
