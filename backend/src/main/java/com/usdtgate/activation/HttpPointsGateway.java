package com.usdtgate.activation;

import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import org.springframework.web.reactive.function.client.WebClient;

import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.Map;

@Component
@Slf4j
public class HttpPointsGateway implements PointsGateway {

    private final IdempotentPostClient client;
    private final ActivationProperties properties;

    public HttpPointsGateway(WebClient.Builder webClientBuilder, ActivationProperties properties) {
        this.client = new IdempotentPostClient(webClientBuilder, Duration.ofMillis(Math.max(1L, properties.getTimeoutMs())));
        this.properties = properties;
    }

    @Override
    public String addPoints(String userId, int amount, String reason, String description, Map<String, Object> metadata) {
        Object paymentId = metadata.get("paymentId");
        if (paymentId == null) {
            throw new ActivationException("paymentId metadata is required");
        }
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("userId", userId);
        body.put("amount", amount);
        body.put("transactionType", reason);
        body.put("description", description);
        body.put("metadata", metadata);
        String transactionId = IdempotentPostClient.requireId(
                client.post(properties.getPointsUrl(), paymentId.toString(), body), "transactionId", "id");
        log.debug("Points service returned {} for payment {}", transactionId, paymentId);
        return transactionId;
    }
}
