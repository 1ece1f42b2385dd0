package com.usdtgate.activation;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.web.reactive.function.client.ClientRequest;
import org.springframework.web.reactive.function.client.ClientResponse;
import org.springframework.web.reactive.function.client.WebClient;
import reactor.core.publisher.Mono;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class HttpActivationGatewaysTest {

    private final List<ClientRequest> requests = new ArrayList<>();
    private HttpStatus status;
    private String responseBody;
    private ActivationProperties properties;
    private WebClient.Builder builder;

    @BeforeEach
    void setUp() {
        status = HttpStatus.OK;
        properties = new ActivationProperties();
        properties.setSubscriptionUrl("http://subscriptions.test/api/subscriptions");
        properties.setPointsUrl("http://points.test/api/points/add");
        builder = WebClient.builder().exchangeFunction(request -> {
            requests.add(request);
            return Mono.just(ClientResponse.create(status)
                    .header(HttpHeaders.CONTENT_TYPE, MediaType.APPLICATION_JSON_VALUE)
                    .body(responseBody)
                    .build());
        });
    }

    @Test
    @DisplayName("Subscription call carries the payment id as idempotency key")
    void subscription_ok() {
        responseBody = "{\"subscriptionId\":\"sub-77\",\"status\":\"active\"}";
        HttpSubscriptionGateway gateway = new HttpSubscriptionGateway(builder, properties);

        String id = gateway.createOrUpgrade("user-1", "premium", "3_months", "USDT-1-aaaa0000");

        assertThat(id).isEqualTo("sub-77");
        assertThat(requests).singleElement().satisfies(r -> {
            assertThat(r.url().toString()).isEqualTo("http://subscriptions.test/api/subscriptions");
            assertThat(r.headers().getFirst(IdempotentPostClient.IDEMPOTENCY_HEADER)).isEqualTo("USDT-1-aaaa0000");
        });
    }

    @Test
    void subscription_fallsBackToIdField() {
        responseBody = "{\"id\":\"sub-78\"}";

        assertThat(new HttpSubscriptionGateway(builder, properties)
                .createOrUpgrade("user-1", "pro", "12_months", "USDT-1-aaaa0001")).isEqualTo("sub-78");
    }

    @Test
    @DisplayName("Server error surfaces as ActivationException")
    void subscription_serverError() {
        status = HttpStatus.SERVICE_UNAVAILABLE;
        responseBody = "{\"error\":\"down\"}";

        assertThatThrownBy(() -> new HttpSubscriptionGateway(builder, properties)
                .createOrUpgrade("user-1", "pro", "12_months", "USDT-1-aaaa0002"))
                .isInstanceOf(ActivationException.class)
                .hasMessageContaining("503");
    }

    @Test
    void subscription_notConfigured() {
        properties.setSubscriptionUrl("");

        assertThatThrownBy(() -> new HttpSubscriptionGateway(builder, properties)
                .createOrUpgrade("user-1", "pro", "12_months", "USDT-1-aaaa0003"))
                .isInstanceOf(ActivationException.class);
        assertThat(requests).isEmpty();
    }

    @Test
    void points_ok() {
        responseBody = "{\"transactionId\":\"ptx-5\"}";
        HttpPointsGateway gateway = new HttpPointsGateway(builder, properties);

        String id = gateway.addPoints("user-2", 500, "purchase", "Points purchase via USDT: USDT-1-bbbb0000",
                Map.of("paymentId", "USDT-1-bbbb0000"));

        assertThat(id).isEqualTo("ptx-5");
        assertThat(requests.get(0).headers().getFirst(IdempotentPostClient.IDEMPOTENCY_HEADER))
                .isEqualTo("USDT-1-bbbb0000");
    }

    @Test
    void points_responseWithoutId_fails() {
        responseBody = "{\"ok\":true}";

        assertThatThrownBy(() -> new HttpPointsGateway(builder, properties)
                .addPoints("user-2", 500, "purchase", "d", Map.of("paymentId", "USDT-1-bbbb0001")))
                .isInstanceOf(ActivationException.class)
                .hasMessageContaining("transactionId");
    }

    @Test
    void points_missingPaymentId_rejectedBeforeCall() {
        assertThatThrownBy(() -> new HttpPointsGateway(builder, properties)
                .addPoints("user-2", 500, "purchase", "d", Map.of()))
                .isInstanceOf(ActivationException.class);
        assertThat(requests).isEmpty();
    }
}
