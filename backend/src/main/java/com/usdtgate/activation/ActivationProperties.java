package com.usdtgate.activation;

import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;

/**
 * Endpoints of the services that grant what a confirmed payment bought.
 */
@ConfigurationProperties(prefix = "usdtgate.activation")
@NoArgsConstructor
@Getter
@Setter
public class ActivationProperties {

    /** POST endpoint creating or upgrading a paid subscription. */
    private String subscriptionUrl;

    /** POST endpoint crediting points to a user. */
    private String pointsUrl;

    private long timeoutMs = 10_000;
}
