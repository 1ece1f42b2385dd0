package com.usdtgate.chain.config;

import com.usdtgate.chain.EvmRpcClient;
import com.usdtgate.chain.RpcEndpointRotator;
import com.usdtgate.chain.WebClientEvmRpcClient;
import com.usdtgate.common.RetryPolicy;
import io.github.resilience4j.ratelimiter.RateLimiter;
import io.github.resilience4j.ratelimiter.RateLimiterConfig;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.web.reactive.function.client.WebClient;

import java.time.Duration;

/**
 * Wires the BSC JSON-RPC client, endpoint rotator and local rate limiter.
 */
@Configuration
@EnableConfigurationProperties({ ChainProperties.class, ChainRpcProperties.class, ChainRetryProperties.class })
public class ChainReaderConfig {

    @Bean
    public RpcEndpointRotator chainRpcEndpointRotator(ChainProperties chainProperties, ChainRetryProperties retry) {
        RetryPolicy policy = new RetryPolicy(
                retry.getBaseDelayMs(),
                retry.getJitterFactor(),
                Math.max(1, retry.getMaxAttempts()),
                retry.getMaxDelayMs());
        return new RpcEndpointRotator(chainProperties.getRpcUrls(), policy);
    }

    @Bean
    public EvmRpcClient evmRpcClient(WebClient.Builder webClientBuilder, ChainProperties chainProperties) {
        return new WebClientEvmRpcClient(webClientBuilder, Duration.ofMillis(Math.max(1L, chainProperties.getRpcTimeoutMs())));
    }

    @Bean(name = "chainRpcRateLimiter")
    public RateLimiter chainRpcRateLimiter(ChainRpcProperties rpcProperties) {
        int rps = Math.max(1, rpcProperties.getMaxRequestsPerSecond());
        RateLimiterConfig config = RateLimiterConfig.custom()
                .limitRefreshPeriod(Duration.ofSeconds(1))
                .limitForPeriod(rps)
                .timeoutDuration(Duration.ofMillis(Math.max(0L, rpcProperties.getLocalLimiterTimeoutMs())))
                .build();
        return RateLimiter.of("bsc-rpc", config);
    }
}
