package com.usdtgate.config;

import com.github.benmanes.caffeine.cache.Caffeine;
import org.springframework.cache.CacheManager;
import org.springframework.cache.annotation.EnableCaching;
import org.springframework.cache.caffeine.CaffeineCacheManager;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Duration;

/**
 * Caffeine in-process caches for chain reads. A sweep asks for the head block once per payment,
 * so the head is cached briefly; mined receipts are cached for the length of a sweep.
 */
@Configuration
@EnableCaching
public class CaffeineConfig {

    public static final String CURRENT_BLOCK_CACHE = "currentBlockCache";
    public static final String RECEIPT_CACHE = "receiptCache";

    @Bean
    public CacheManager caffeineCacheManager() {
        CaffeineCacheManager manager = new CaffeineCacheManager();
        manager.registerCustomCache(CURRENT_BLOCK_CACHE, Caffeine.newBuilder()
                .expireAfterWrite(Duration.ofSeconds(1))
                .maximumSize(1)
                .build());
        manager.registerCustomCache(RECEIPT_CACHE, Caffeine.newBuilder()
                .expireAfterWrite(Duration.ofSeconds(20))
                .maximumSize(2_000)
                .build());
        return manager;
    }
}
