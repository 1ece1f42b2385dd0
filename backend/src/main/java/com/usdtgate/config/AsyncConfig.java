package com.usdtgate.config;

import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.annotation.EnableAsync;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

import java.util.concurrent.Executor;

/**
 * Named thread pools: verification-executor fans out per-payment checks within one sweep,
 * notify-executor delivers webhooks off the sweep thread.
 */
@Configuration
@EnableAsync
public class AsyncConfig {

    public static final String VERIFICATION_EXECUTOR = "verification-executor";
    public static final String NOTIFY_EXECUTOR = "notify-executor";

    @Bean(name = VERIFICATION_EXECUTOR)
    public ThreadPoolTaskExecutor verificationExecutor(
            @Value("${usdtgate.verification.worker-threads:4}") int workerThreads) {
        int size = Math.max(1, workerThreads);
        ThreadPoolTaskExecutor e = new ThreadPoolTaskExecutor();
        e.setCorePoolSize(size);
        e.setMaxPoolSize(size);
        e.setThreadNamePrefix("verify-");
        e.setWaitForTasksToCompleteOnShutdown(true);
        e.setAwaitTerminationSeconds(30);
        e.initialize();
        return e;
    }

    @Bean(name = NOTIFY_EXECUTOR)
    public Executor notifyExecutor() {
        ThreadPoolTaskExecutor e = new ThreadPoolTaskExecutor();
        e.setCorePoolSize(2);
        e.setMaxPoolSize(2);
        e.setQueueCapacity(1_000);
        e.setThreadNamePrefix("notify-");
        e.initialize();
        return e;
    }
}
