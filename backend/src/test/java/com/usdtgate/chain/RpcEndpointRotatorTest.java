package com.usdtgate.chain;

import com.usdtgate.common.RetryPolicy;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.stream.IntStream;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class RpcEndpointRotatorTest {

    @Test
    void nextEndpoint_roundRobins() {
        RpcEndpointRotator rotator = new RpcEndpointRotator(
                List.of("https://a.com", "https://b.com", "https://c.com"),
                RetryPolicy.defaultPolicy());
        assertThat(rotator.nextEndpoint(0)).isEqualTo("https://a.com");
        assertThat(rotator.nextEndpoint(0)).isEqualTo("https://b.com");
        assertThat(rotator.nextEndpoint(0)).isEqualTo("https://c.com");
        assertThat(rotator.nextEndpoint(0)).isEqualTo("https://a.com");
    }

    @Test
    void nextEndpoint_singleEndpoint_alwaysSame() {
        RpcEndpointRotator rotator = new RpcEndpointRotator(List.of("https://only.com"), null);
        IntStream.range(0, 5).forEach(i -> assertThat(rotator.nextEndpoint(0)).isEqualTo("https://only.com"));
    }

    @Test
    void nextEndpoint_skipsEndpointCoolingDown() {
        RpcEndpointRotator rotator = new RpcEndpointRotator(List.of("https://a.com", "https://b.com"), null);
        assertThat(rotator.coolDown("https://a.com", 30_000, 1_000)).isTrue();

        IntStream.range(0, 4).forEach(i -> assertThat(rotator.nextEndpoint(2_000)).isEqualTo("https://b.com"));
        assertThat(rotator.isCoolingDown("https://a.com", 2_000)).isTrue();
        assertThat(rotator.isCoolingDown("https://a.com", 31_000)).isFalse();
    }

    @Test
    void coolDown_alreadyCooling_returnsFalse() {
        RpcEndpointRotator rotator = new RpcEndpointRotator(List.of("https://a.com"), null);
        assertThat(rotator.coolDown("https://a.com", 30_000, 0)).isTrue();
        assertThat(rotator.coolDown("https://a.com", 30_000, 10)).isFalse();
    }

    @Test
    void nextEndpoint_allCoolingDown_stillReturnsOne() {
        RpcEndpointRotator rotator = new RpcEndpointRotator(List.of("https://a.com", "https://b.com"), null);
        rotator.coolDown("https://a.com", 30_000, 0);
        rotator.coolDown("https://b.com", 30_000, 0);
        assertThat(rotator.nextEndpoint(100)).isIn("https://a.com", "https://b.com");
    }

    @Test
    void retryDelayMs_usesPolicy() {
        RpcEndpointRotator rotator = new RpcEndpointRotator(List.of("https://a.com"), new RetryPolicy(100L, 0, 3));
        assertThat(rotator.retryDelayMs(0)).isEqualTo(100L);
        assertThat(rotator.retryDelayMs(1)).isEqualTo(200L);
        assertThat(rotator.getMaxAttempts()).isEqualTo(3);
    }

    @Test
    void constructor_emptyEndpoints_throws() {
        assertThatThrownBy(() -> new RpcEndpointRotator(List.of(), null))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("At least one endpoint");
        assertThatThrownBy(() -> new RpcEndpointRotator(null, null))
                .isInstanceOf(IllegalArgumentException.class);
    }
}
