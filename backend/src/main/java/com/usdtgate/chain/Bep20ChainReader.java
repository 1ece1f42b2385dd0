package com.usdtgate.chain;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.usdtgate.chain.config.ChainProperties;
import com.usdtgate.chain.config.ChainRpcProperties;
import com.usdtgate.common.EvmHex;
import com.usdtgate.config.CaffeineConfig;
import io.github.resilience4j.ratelimiter.RateLimiter;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.cache.Cache;
import org.springframework.cache.CacheManager;
import org.springframework.stereotype.Component;

import java.math.BigDecimal;
import java.math.BigInteger;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Comparator;
import java.util.HashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;

/**
 * USDT-BEP20 reader over BSC JSON-RPC. Each read rotates endpoints, waits on the local rate limiter and
 * retries transient failures with backoff before giving up as unavailable.
 * Transfer discovery uses eth_getLogs filtered by token contract and recipient topic, newest blocks first.
 */
@Slf4j
@Component
public class Bep20ChainReader implements ChainReader {

    static final int MIN_CHUNK_SIZE = 25;
    private static final String BALANCE_OF_SELECTOR = "0x70a08231";
    private static final String HEAD_KEY = "head";

    private final EvmRpcClient rpcClient;
    private final RpcEndpointRotator rotator;
    private final RateLimiter rateLimiter;
    private final ChainProperties chainProperties;
    private final ChainRpcProperties rpcProperties;
    private final ObjectMapper objectMapper;
    private final CacheManager cacheManager;

    public Bep20ChainReader(
            EvmRpcClient rpcClient,
            RpcEndpointRotator rotator,
            @Qualifier("chainRpcRateLimiter") RateLimiter rateLimiter,
            ChainProperties chainProperties,
            ChainRpcProperties rpcProperties,
            ObjectMapper objectMapper,
            CacheManager cacheManager
    ) {
        this.rpcClient = rpcClient;
        this.rotator = rotator;
        this.rateLimiter = rateLimiter;
        this.chainProperties = chainProperties;
        this.rpcProperties = rpcProperties;
        this.objectMapper = objectMapper;
        this.cacheManager = cacheManager;
    }

    @Override
    public ChainResult<ChainTransaction> getTransaction(String txHash) {
        try {
            JsonNode tx = callWithRetry("eth_getTransactionByHash", List.of(txHash));
            if (tx.isNull()) {
                return ChainResult.notFound();
            }
            return ChainResult.found(new ChainTransaction(
                    text(tx, "hash"),
                    EvmHex.normalizeAddress(text(tx, "from")),
                    EvmHex.normalizeAddress(text(tx, "to")),
                    EvmHex.parseQuantity(text(tx, "blockNumber")),
                    EvmHex.parseBigInteger(text(tx, "value")),
                    text(tx, "input")));
        } catch (ChainUnavailableException | RpcException e) {
            log.warn("getTransaction {} unavailable: {}", txHash, messageOf(e));
            return ChainResult.unavailable(messageOf(e));
        }
    }

    @Override
    public ChainResult<TransactionReceipt> getReceipt(String txHash) {
        String key = txHash.toLowerCase(Locale.ROOT);
        Cache cache = cacheManager.getCache(CaffeineConfig.RECEIPT_CACHE);
        Cache.ValueWrapper cached = cache != null ? cache.get(key) : null;
        if (cached != null && cached.get() instanceof TransactionReceipt receipt) {
            return ChainResult.found(receipt);
        }
        try {
            JsonNode node = callWithRetry("eth_getTransactionReceipt", List.of(txHash));
            if (node.isNull() || EvmHex.parseQuantity(text(node, "blockNumber")) == null) {
                return ChainResult.notFound();
            }
            if (EvmHex.parseQuantity(text(node, "status")) == null) {
                return ChainResult.unavailable("receipt for " + txHash + " has no status field");
            }
            TransactionReceipt receipt = parseReceipt(node);
            if (cache != null) {
                cache.put(key, receipt);
            }
            return ChainResult.found(receipt);
        } catch (ChainUnavailableException | RpcException e) {
            log.warn("getReceipt {} unavailable: {}", txHash, messageOf(e));
            return ChainResult.unavailable(messageOf(e));
        }
    }

    @Override
    public ChainResult<Long> getConfirmations(String txHash) {
        ChainResult<TransactionReceipt> receipt = getReceipt(txHash);
        if (!receipt.isFound()) {
            return receipt.map(r -> 0L);
        }
        try {
            long head = getCurrentBlock();
            return ChainResult.found(Math.max(1L, head - receipt.value().blockNumber() + 1));
        } catch (ChainUnavailableException e) {
            return ChainResult.unavailable(messageOf(e));
        }
    }

    @Override
    public ChainResult<Boolean> isTransactionSuccessful(String txHash) {
        return getReceipt(txHash).map(TransactionReceipt::isSuccessful);
    }

    @Override
    public ChainResult<TransferMatch> findTransfer(TransferQuery query) {
        long head;
        try {
            head = getCurrentBlock();
        } catch (ChainUnavailableException e) {
            return ChainResult.unavailable(messageOf(e));
        }
        long oldest = Math.max(0L, head - Math.max(1, query.maxBlocksToScan()) + 1);
        List<Object> topics = Arrays.asList(
                TransferEvent.TRANSFER_TOPIC,
                query.fromAddress() != null ? EvmHex.padAddressForTopic(query.fromAddress()) : null,
                EvmHex.padAddressForTopic(query.toAddress()));
        int chunk = Math.max(MIN_CHUNK_SIZE, chainProperties.getLogChunkBlocks());
        try {
            long end = head;
            while (end >= oldest) {
                long start = Math.max(oldest, end - chunk + 1);
                Optional<TransferMatch> match = newestMatch(fetchTransferLogs(start, end, topics), query, head);
                if (match.isPresent()) {
                    return ChainResult.found(match.get());
                }
                end = start - 1;
            }
            return ChainResult.notFound();
        } catch (ChainUnavailableException | RpcException e) {
            log.warn("findTransfer to {} unavailable: {}", query.toAddress(), messageOf(e));
            return ChainResult.unavailable(messageOf(e));
        }
    }

    @Override
    public BigDecimal getBalance(String address) {
        Map<String, Object> call = new HashMap<>();
        call.put("to", chainProperties.getTokenContract());
        call.put("data", BALANCE_OF_SELECTOR + EvmHex.padAddressForTopic(address).substring(2));
        JsonNode result = callWithRetry("eth_call", Arrays.asList(call, "latest"));
        try {
            return EvmHex.toTokenAmount(EvmHex.parseBigInteger(result.asText()), chainProperties.getTokenDecimals());
        } catch (NumberFormatException e) {
            throw new ChainUnavailableException("balanceOf returned malformed value: " + result, e);
        }
    }

    @Override
    public long getCurrentBlock() {
        Cache cache = cacheManager.getCache(CaffeineConfig.CURRENT_BLOCK_CACHE);
        Cache.ValueWrapper cached = cache != null ? cache.get(HEAD_KEY) : null;
        if (cached != null && cached.get() instanceof Long head) {
            return head;
        }
        JsonNode result = callWithRetry("eth_blockNumber", List.of());
        Long head = EvmHex.parseQuantity(result.asText());
        if (head == null) {
            throw new ChainUnavailableException("eth_blockNumber returned " + result, null);
        }
        if (cache != null) {
            cache.put(HEAD_KEY, head);
        }
        return head;
    }

    private List<JsonNode> fetchTransferLogs(long fromBlock, long toBlock, List<Object> topics) {
        Map<String, Object> filter = new HashMap<>();
        filter.put("fromBlock", EvmHex.toHexQuantity(fromBlock));
        filter.put("toBlock", EvmHex.toHexQuantity(toBlock));
        filter.put("address", chainProperties.getTokenContract());
        filter.put("topics", topics);
        try {
            JsonNode result = callWithRetry("eth_getLogs", List.of(filter));
            List<JsonNode> logs = new ArrayList<>();
            if (result.isArray()) {
                result.forEach(logs::add);
            }
            return logs;
        } catch (RpcException e) {
            if (isRangeTooWideError(e) && (toBlock - fromBlock) > MIN_CHUNK_SIZE) {
                log.warn("Reducing eth_getLogs range [{}-{}]: {}", fromBlock, toBlock, e.getMessage());
                long mid = fromBlock + (toBlock - fromBlock) / 2;
                List<JsonNode> combined = new ArrayList<>(fetchTransferLogs(mid + 1, toBlock, topics));
                combined.addAll(fetchTransferLogs(fromBlock, mid, topics));
                return combined;
            }
            throw e;
        }
    }

    private Optional<TransferMatch> newestMatch(List<JsonNode> logs, TransferQuery query, long head) {
        BigDecimal allowed = query.expectedAmount().multiply(query.toleranceFraction()).abs();
        return logs.stream()
                .filter(l -> !l.path("removed").asBoolean(false))
                .filter(l -> EvmHex.sameAddress(text(l, "address"), chainProperties.getTokenContract()))
                .filter(l -> !query.excludedTransactionHashes().contains(
                        String.valueOf(text(l, "transactionHash")).toLowerCase(Locale.ROOT)))
                .map(l -> toMatch(l, head))
                .flatMap(Optional::stream)
                .filter(m -> EvmHex.sameAddress(m.toAddress(), query.toAddress()))
                .filter(m -> query.fromAddress() == null || EvmHex.sameAddress(m.fromAddress(), query.fromAddress()))
                .filter(m -> m.amount().subtract(query.expectedAmount()).abs().compareTo(allowed) <= 0)
                .max(Comparator.comparingLong(TransferMatch::blockNumber));
    }

    private Optional<TransferMatch> toMatch(JsonNode logNode, long head) {
        Long block = EvmHex.parseQuantity(text(logNode, "blockNumber"));
        String txHash = text(logNode, "transactionHash");
        if (block == null || txHash == null) {
            return Optional.empty();
        }
        return TransferEvent.decode(toLog(logNode)).map(event -> new TransferMatch(
                txHash.toLowerCase(Locale.ROOT),
                event.from(),
                event.to(),
                EvmHex.toTokenAmount(event.value(), chainProperties.getTokenDecimals()),
                block,
                Math.max(1L, head - block + 1)));
    }

    private TransactionReceipt parseReceipt(JsonNode node) {
        List<TransactionReceipt.Log> logs = new ArrayList<>();
        for (JsonNode l : node.path("logs")) {
            logs.add(toLog(l));
        }
        Long status = EvmHex.parseQuantity(text(node, "status"));
        return new TransactionReceipt(
                text(node, "transactionHash"),
                status != null ? status.intValue() : 0,
                EvmHex.parseQuantity(text(node, "blockNumber")),
                EvmHex.normalizeAddress(text(node, "from")),
                EvmHex.normalizeAddress(text(node, "to")),
                EvmHex.parseQuantity(text(node, "gasUsed")),
                logs);
    }

    private static TransactionReceipt.Log toLog(JsonNode l) {
        List<String> topics = new ArrayList<>();
        l.path("topics").forEach(t -> topics.add(t.asText()));
        return new TransactionReceipt.Log(text(l, "address"), topics, text(l, "data"),
                EvmHex.parseQuantity(text(l, "logIndex")));
    }

    /**
     * Calls {@code method} until it succeeds or the rotator's attempts are used up.
     * Range errors from eth_getLogs are rethrown at once so the caller can split the range.
     *
     * @return the JSON-RPC {@code result} node (NullNode for a null result)
     */
    JsonNode callWithRetry(String method, Object params) {
        Exception last = null;
        for (int attempt = 0; attempt < rotator.getMaxAttempts(); attempt++) {
            if (attempt > 0) {
                sleep(rotator.retryDelayMs(attempt - 1));
            }
            String endpoint = rotator.nextEndpoint(System.currentTimeMillis());
            try {
                return extractResult(method, callRpc(endpoint, method, params));
            } catch (RpcException e) {
                if (isRangeTooWideError(e)) {
                    throw e;
                }
                last = e;
                if (isRateLimited(e)
                        && rotator.coolDown(endpoint, rpcProperties.getEndpointCooldownMs(), System.currentTimeMillis())) {
                    log.warn("Endpoint {} cooled down for {} ms after rate limit: {}",
                            endpoint, rpcProperties.getEndpointCooldownMs(), messageOf(e));
                } else {
                    log.debug("{} attempt {} on {} failed: {}", method, attempt + 1, endpoint, messageOf(e));
                }
            } catch (RuntimeException e) {
                last = e;
                log.debug("{} attempt {} on {} failed: {}", method, attempt + 1, endpoint, messageOf(e));
            }
        }
        throw new ChainUnavailableException(
                method + " failed after " + rotator.getMaxAttempts() + " attempts: " + messageOf(last), last);
    }

    private JsonNode extractResult(String method, String json) {
        if (json == null || json.isBlank()) {
            throw new RpcException(method + " returned an empty response");
        }
        JsonNode root;
        try {
            root = objectMapper.readTree(json);
        } catch (JsonProcessingException e) {
            throw new RpcException("Failed to parse " + method + " response", e);
        }
        JsonNode error = root.path("error");
        if (!error.isMissingNode() && !error.isNull()) {
            throw new RpcException(method + " error: " + error);
        }
        JsonNode result = root.path("result");
        if (result.isMissingNode()) {
            throw new RpcException(method + " response has no result");
        }
        return result;
    }

    private String callRpc(String endpoint, String method, Object params) {
        long acquireStart = System.nanoTime();
        boolean permitted = rateLimiter.acquirePermission();
        long waitedMs = (System.nanoTime() - acquireStart) / 1_000_000L;
        if (!permitted) {
            throw new RpcException("Local limiter timeout before " + method + " on " + endpoint);
        }
        if (waitedMs >= Math.max(1L, rpcProperties.getLocalLimiterLogThresholdMs())) {
            log.info("Local RPC limiter delayed {} ms before {} on {}", waitedMs, method, endpoint);
        }
        return rpcClient.call(endpoint, method, params).block();
    }

    private static void sleep(long ms) {
        try {
            Thread.sleep(ms);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new ChainUnavailableException("Interrupted during RPC retry backoff", e);
        }
    }

    static boolean isRangeTooWideError(Exception e) {
        if (e == null || e.getMessage() == null) return false;
        String msg = e.getMessage().toLowerCase(Locale.ROOT);
        return msg.contains("-32701") || msg.contains("query returned more than")
                || msg.contains("too many results") || msg.contains("block range is too wide")
                || msg.contains("exceed maximum block range") || msg.contains("limit exceeded for range")
                || msg.contains("log response size exceeded");
    }

    static boolean isRateLimited(Exception e) {
        if (e == null || e.getMessage() == null) return false;
        String msg = e.getMessage().toLowerCase(Locale.ROOT);
        return msg.contains("429") || msg.contains("too many requests")
                || msg.contains("rate limit") || msg.contains("request limit") || msg.contains("-32005");
    }

    private static String text(JsonNode node, String field) {
        JsonNode value = node.get(field);
        return value == null || value.isNull() ? null : value.asText();
    }

    private static String messageOf(Exception e) {
        if (e == null || e.getMessage() == null || e.getMessage().isBlank()) {
            return "unknown";
        }
        return e.getMessage();
    }
}
