package com.usdtgate.store;

import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;

/**
 * Payment intent defaults.
 */
@ConfigurationProperties(prefix = "usdtgate.payment")
@NoArgsConstructor
@Getter
@Setter
public class PaymentProperties {

    /** Minutes from creation until an unpaid intent expires. */
    private int ttlMinutes = 30;

    private int requiredConfirmations = 12;

    /** Queue a new payment for scanning right away instead of waiting for the user to confirm the transfer. */
    private boolean scanOnCreate = true;

    /** Check the sender's USDT balance at creation when a sender address is supplied. */
    private boolean balanceCheckEnabled = false;
}
