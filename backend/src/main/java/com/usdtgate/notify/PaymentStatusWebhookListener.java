package com.usdtgate.notify;

import com.usdtgate.config.AsyncConfig;
import com.usdtgate.domain.PaymentStatusChangedEvent;
import lombok.RequiredArgsConstructor;
import org.springframework.context.event.EventListener;
import org.springframework.scheduling.annotation.Async;
import org.springframework.stereotype.Component;

/**
 * Forwards status changes to the webhook off the publishing thread.
 */
@Component
@RequiredArgsConstructor
public class PaymentStatusWebhookListener {

    private final WebhookNotifier webhookNotifier;

    @Async(AsyncConfig.NOTIFY_EXECUTOR)
    @EventListener
    public void onStatusChanged(PaymentStatusChangedEvent event) {
        webhookNotifier.send(WebhookPayload.from(event));
    }
}
