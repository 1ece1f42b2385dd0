package com.usdtgate.notify;

import lombok.extern.slf4j.Slf4j;
import org.springframework.http.MediaType;
import org.springframework.stereotype.Component;
import org.springframework.web.reactive.function.client.WebClient;
import org.springframework.web.reactive.function.client.WebClientResponseException;
import reactor.util.retry.Retry;

import java.time.Duration;
import java.util.Set;

/**
 * Posts webhook payloads with exponential backoff. Client errors that a retry cannot fix are not retried.
 */
@Component
@Slf4j
public class WebClientWebhookNotifier implements WebhookNotifier {

    static final String SECRET_HEADER = "X-Webhook-Secret";
    private static final Set<Integer> NON_RETRYABLE = Set.of(400, 401, 403, 404);

    private final WebClient webClient;
    private final WebhookProperties properties;

    public WebClientWebhookNotifier(WebClient.Builder webClientBuilder, WebhookProperties properties) {
        this.webClient = webClientBuilder.build();
        this.properties = properties;
    }

    @Override
    public boolean send(WebhookPayload payload) {
        String url = properties.getUrl();
        if (url == null || url.isBlank()) {
            return false;
        }
        try {
            webClient.post()
                    .uri(url)
                    .contentType(MediaType.APPLICATION_JSON)
                    .headers(h -> {
                        if (properties.getSecret() != null && !properties.getSecret().isBlank()) {
                            h.set(SECRET_HEADER, properties.getSecret());
                        }
                    })
                    .bodyValue(payload)
                    .retrieve()
                    .toBodilessEntity()
                    .timeout(Duration.ofMillis(properties.getTimeoutMs()))
                    .retryWhen(Retry.backoff(properties.getMaxRetries(), Duration.ofMillis(properties.getInitialBackoffMs()))
                            .maxBackoff(Duration.ofMillis(properties.getMaxBackoffMs()))
                            .filter(WebClientWebhookNotifier::isRetryable)
                            .onRetryExhaustedThrow((spec, signal) -> signal.failure()))
                    .block();
            log.debug("Webhook {} delivered for payment {}", payload.event(), payload.paymentId());
            return true;
        } catch (RuntimeException e) {
            log.warn("Webhook {} for payment {} not delivered: {}", payload.event(), payload.paymentId(), e.getMessage());
            return false;
        }
    }

    static boolean isRetryable(Throwable error) {
        if (error instanceof WebClientResponseException responseError) {
            return !NON_RETRYABLE.contains(responseError.getStatusCode().value());
        }
        return true;
    }
}
