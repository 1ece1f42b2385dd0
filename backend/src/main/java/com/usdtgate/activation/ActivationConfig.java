package com.usdtgate.activation;

import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Configuration;

@Configuration
@EnableConfigurationProperties(ActivationProperties.class)
public class ActivationConfig {
}
