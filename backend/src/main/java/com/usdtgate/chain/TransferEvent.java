package com.usdtgate.chain;

import com.usdtgate.common.EvmHex;

import java.math.BigInteger;
import java.util.List;
import java.util.Optional;

/**
 * A decoded ERC20/BEP20 {@code Transfer(address,address,uint256)} log.
 */
public record TransferEvent(String tokenAddress, String from, String to, BigInteger value, Long logIndex) {

    public static final String TRANSFER_TOPIC = "0xddf252ad1be2c89b69c2b068fc378daa952ba7f163c4a11628f55a4df523b3ef";

    /** Decodes the log when topic0 is the Transfer signature and both parties are indexed. */
    public static Optional<TransferEvent> decode(TransactionReceipt.Log log) {
        List<String> topics = log.topics();
        if (topics.size() < 3 || !TRANSFER_TOPIC.equalsIgnoreCase(topics.get(0))) {
            return Optional.empty();
        }
        BigInteger value;
        try {
            value = EvmHex.parseBigInteger(log.data());
        } catch (NumberFormatException e) {
            return Optional.empty();
        }
        return Optional.of(new TransferEvent(
                EvmHex.normalizeAddress(log.address()),
                EvmHex.topicToAddress(topics.get(1)),
                EvmHex.topicToAddress(topics.get(2)),
                value,
                log.logIndex()));
    }
}
