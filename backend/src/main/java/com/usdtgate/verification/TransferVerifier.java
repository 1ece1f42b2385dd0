package com.usdtgate.verification;

import com.usdtgate.chain.TransactionReceipt;
import com.usdtgate.chain.TransferEvent;
import com.usdtgate.common.EvmHex;

import java.math.BigDecimal;
import java.util.List;
import java.util.Optional;

/**
 * Decides whether a mined receipt pays {@code expectedAmount} of the token to {@code expectedRecipient}.
 * Works only on already-fetched data.
 */
public class TransferVerifier {

    public static final String REASON_REVERTED = "transaction reverted";
    public static final String REASON_WRONG_CONTRACT = "not a USDT contract call";
    public static final String REASON_NO_TRANSFER = "no transfer event";
    public static final String REASON_RECIPIENT_MISMATCH = "recipient mismatch";
    public static final String REASON_AMOUNT_MISMATCH = "amount mismatch";

    private final String tokenContract;
    private final int tokenDecimals;

    public TransferVerifier(String tokenContract, int tokenDecimals) {
        if (!EvmHex.isAddress(tokenContract)) {
            throw new IllegalArgumentException("Invalid token contract address: " + tokenContract);
        }
        this.tokenContract = EvmHex.normalizeAddress(tokenContract);
        this.tokenDecimals = tokenDecimals;
    }

    public VerificationResult verify(TransactionReceipt receipt, String expectedRecipient,
                                     BigDecimal expectedAmount, BigDecimal tolerance) {
        if (!receipt.isSuccessful()) {
            return VerificationResult.invalid(REASON_REVERTED);
        }
        if (!EvmHex.sameAddress(receipt.to(), tokenContract)) {
            return VerificationResult.invalid(REASON_WRONG_CONTRACT + " (to=" + receipt.to() + ")");
        }
        List<TransferEvent> transfers = receipt.logs().stream()
                .filter(l -> EvmHex.sameAddress(l.address(), tokenContract))
                .map(TransferEvent::decode)
                .flatMap(Optional::stream)
                .toList();
        if (transfers.isEmpty()) {
            return VerificationResult.invalid(REASON_NO_TRANSFER);
        }
        Optional<TransferEvent> toRecipient = transfers.stream()
                .filter(t -> EvmHex.sameAddress(t.to(), expectedRecipient))
                .findFirst();
        if (toRecipient.isEmpty()) {
            return VerificationResult.invalid(REASON_RECIPIENT_MISMATCH + ": expected " + expectedRecipient
                    + ", got " + transfers.get(0).to());
        }
        TransferEvent transfer = toRecipient.get();
        BigDecimal actual = EvmHex.toTokenAmount(transfer.value(), tokenDecimals);
        if (actual.subtract(expectedAmount).abs().compareTo(tolerance) > 0) {
            return VerificationResult.invalid(REASON_AMOUNT_MISMATCH + ": expected "
                    + expectedAmount.stripTrailingZeros().toPlainString() + " USDT, got "
                    + actual.stripTrailingZeros().toPlainString() + " USDT");
        }
        return VerificationResult.valid(new VerificationResult.TransferDetails(
                receipt.transactionHash(),
                transfer.from(),
                transfer.to(),
                actual,
                receipt.blockNumber(),
                receipt.gasUsed()));
    }
}
