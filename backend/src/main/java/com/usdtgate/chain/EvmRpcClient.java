package com.usdtgate.chain;

import reactor.core.publisher.Mono;

/**
 * EVM JSON-RPC transport. Retries, endpoint rotation and throttling live in {@link Bep20ChainReader}.
 */
public interface EvmRpcClient {

    /**
     * Perform a single JSON-RPC call.
     *
     * @param endpointUrl RPC endpoint URL
     * @param method      e.g. "eth_getTransactionReceipt"
     * @param params      positional params
     * @return raw response body (JSON); errors with {@link RpcException} on HTTP failure or timeout
     */
    Mono<String> call(String endpointUrl, String method, Object params);
}
