package com.usdtgate.chain.config;

import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.util.ArrayList;
import java.util.List;

/**
 * BSC endpoints and the USDT-BEP20 token being watched.
 */
@ConfigurationProperties(prefix = "usdtgate.chain")
@NoArgsConstructor
@Getter
@Setter
public class ChainProperties {

    /** JSON-RPC endpoints, used round-robin. */
    private List<String> rpcUrls = new ArrayList<>(List.of("https://bsc-dataseed.binance.org/"));

    /** USDT-BEP20 contract. */
    private String tokenContract = "0x55d398326f99059fF775485246999027B3197955";

    private int tokenDecimals = 18;

    /** Platform wallet that receives payments. */
    private String receivingAddress;

    /** Hard timeout per RPC call. */
    private long rpcTimeoutMs = 5_000;

    /** Block span of one eth_getLogs request while scanning; halved when a node rejects the range. */
    private int logChunkBlocks = 500;
}
