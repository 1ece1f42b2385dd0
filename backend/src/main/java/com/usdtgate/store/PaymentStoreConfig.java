package com.usdtgate.store;

import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Configuration;

/**
 * Payment store configuration: properties.
 */
@Configuration
@EnableConfigurationProperties(PaymentProperties.class)
public class PaymentStoreConfig {
}
