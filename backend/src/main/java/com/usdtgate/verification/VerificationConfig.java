package com.usdtgate.verification;

import com.usdtgate.chain.config.ChainProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

@Configuration
public class VerificationConfig {

    @Bean
    public TransferVerifier transferVerifier(ChainProperties chainProperties) {
        return new TransferVerifier(chainProperties.getTokenContract(), chainProperties.getTokenDecimals());
    }
}
