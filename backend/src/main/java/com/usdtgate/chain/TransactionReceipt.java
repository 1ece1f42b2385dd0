package com.usdtgate.chain;

import java.util.List;

/**
 * Result of eth_getTransactionReceipt. {@code to} is the called contract for token transfers.
 */
public record TransactionReceipt(
        String transactionHash,
        int status,
        long blockNumber,
        String from,
        String to,
        Long gasUsed,
        List<Log> logs
) {

    public TransactionReceipt {
        logs = logs != null ? List.copyOf(logs) : List.of();
    }

    public boolean isSuccessful() {
        return status == 1;
    }

    public record Log(String address, List<String> topics, String data, Long logIndex) {

        public Log {
            topics = topics != null ? List.copyOf(topics) : List.of();
        }
    }
}
