package com.usdtgate.notify;

import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;

/**
 * Outbound status webhook. Delivery is disabled while {@code url} is blank.
 */
@ConfigurationProperties(prefix = "usdtgate.webhook")
@NoArgsConstructor
@Getter
@Setter
public class WebhookProperties {

    private String url;

    /** Sent as X-Webhook-Secret. */
    private String secret;

    private int maxRetries = 3;

    private long initialBackoffMs = 2_000;

    private long maxBackoffMs = 30_000;

    private long timeoutMs = 10_000;
}
