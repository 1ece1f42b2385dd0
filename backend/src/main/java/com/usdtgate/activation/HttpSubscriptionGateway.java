package com.usdtgate.activation;

import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import org.springframework.web.reactive.function.client.WebClient;

import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.Map;

@Component
@Slf4j
public class HttpSubscriptionGateway implements SubscriptionGateway {

    private final IdempotentPostClient client;
    private final ActivationProperties properties;

    public HttpSubscriptionGateway(WebClient.Builder webClientBuilder, ActivationProperties properties) {
        this.client = new IdempotentPostClient(webClientBuilder, Duration.ofMillis(Math.max(1L, properties.getTimeoutMs())));
        this.properties = properties;
    }

    @Override
    public String createOrUpgrade(String userId, String plan, String duration, String paymentId) {
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("userId", userId);
        body.put("plan", plan);
        body.put("duration", duration);
        body.put("paymentId", paymentId);
        body.put("paymentMethod", ActivationDispatcher.PAYMENT_METHOD);
        String subscriptionId = IdempotentPostClient.requireId(
                client.post(properties.getSubscriptionUrl(), paymentId, body), "subscriptionId", "id");
        log.debug("Subscription service returned {} for payment {}", subscriptionId, paymentId);
        return subscriptionId;
    }
}
