package com.usdtgate.activation;

import com.fasterxml.jackson.databind.JsonNode;
import org.springframework.http.MediaType;
import org.springframework.web.reactive.function.client.WebClient;
import org.springframework.web.reactive.function.client.WebClientException;
import org.springframework.web.reactive.function.client.WebClientResponseException;

import java.time.Duration;
import java.util.Map;
import java.util.concurrent.TimeoutException;

/**
 * Blocking JSON POST with an {@code Idempotency-Key} header and a hard timeout.
 */
final class IdempotentPostClient {

    static final String IDEMPOTENCY_HEADER = "Idempotency-Key";

    private final WebClient webClient;
    private final Duration timeout;

    IdempotentPostClient(WebClient.Builder webClientBuilder, Duration timeout) {
        this.webClient = webClientBuilder.build();
        this.timeout = timeout;
    }

    JsonNode post(String url, String idempotencyKey, Map<String, Object> body) {
        if (url == null || url.isBlank()) {
            throw new ActivationException("Activation endpoint not configured");
        }
        try {
            JsonNode response = webClient.post()
                    .uri(url)
                    .contentType(MediaType.APPLICATION_JSON)
                    .header(IDEMPOTENCY_HEADER, idempotencyKey)
                    .bodyValue(body)
                    .retrieve()
                    .bodyToMono(JsonNode.class)
                    .timeout(timeout)
                    .block();
            if (response == null) {
                throw new ActivationException("Empty response from " + url);
            }
            return response;
        } catch (WebClientResponseException e) {
            throw new ActivationException("HTTP " + e.getStatusCode().value() + " from " + url, e);
        } catch (WebClientException e) {
            throw new ActivationException("Call to " + url + " failed: " + e.getMessage(), e);
        } catch (RuntimeException e) {
            if (e.getCause() instanceof TimeoutException) {
                throw new ActivationException("Timed out after " + timeout.toMillis() + "ms calling " + url, e);
            }
            throw e;
        }
    }

    /** First non-blank text among {@code fields}. */
    static String requireId(JsonNode response, String... fields) {
        for (String field : fields) {
            JsonNode node = response.path(field);
            if (node.isValueNode() && !node.asText().isBlank()) {
                return node.asText();
            }
        }
        throw new ActivationException("Response carries none of " + String.join(", ", fields));
    }
}
