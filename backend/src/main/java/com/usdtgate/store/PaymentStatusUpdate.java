package com.usdtgate.store;

/**
 * Optional fields written together with a status change; null fields are left untouched.
 */
public record PaymentStatusUpdate(
        String transactionHash,
        Long blockNumber,
        Integer confirmationCount,
        String fromAddress,
        String errorMessage,
        Long gasUsed
) {

    public static PaymentStatusUpdate none() {
        return new PaymentStatusUpdate(null, null, null, null, null, null);
    }

    public static PaymentStatusUpdate error(String errorMessage) {
        return new PaymentStatusUpdate(null, null, null, null, errorMessage, null);
    }

    public static PaymentStatusUpdate transaction(String transactionHash, Long blockNumber, Integer confirmationCount) {
        return new PaymentStatusUpdate(transactionHash, blockNumber, confirmationCount, null, null, null);
    }

    public PaymentStatusUpdate withFromAddress(String from) {
        return new PaymentStatusUpdate(transactionHash, blockNumber, confirmationCount, from, errorMessage, gasUsed);
    }

    public PaymentStatusUpdate withGasUsed(Long gas) {
        return new PaymentStatusUpdate(transactionHash, blockNumber, confirmationCount, fromAddress, errorMessage, gas);
    }
}
