package com.usdtgate.verification;

import com.usdtgate.chain.TransactionReceipt;
import com.usdtgate.chain.TransferEvent;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

import java.math.BigDecimal;
import java.math.BigInteger;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class TransferVerifierTest {

    private static final String TOKEN = "0x55d398326f99059fF775485246999027B3197955";
    private static final String RECIPIENT = "0xAbCdEf0123456789aBcDeF0123456789AbCdEf01";
    private static final String SENDER = "0x2222222222222222222222222222222222222222";
    private static final String TX = "0x" + "c".repeat(64);
    private static final BigDecimal TOLERANCE = new BigDecimal("0.01");

    private final TransferVerifier verifier = new TransferVerifier(TOKEN, 18);

    @Test
    @DisplayName("Valid transfer returns sender, amount, block and gas")
    void verify_matchingTransfer_isValid() {
        TransactionReceipt receipt = receipt(1, TOKEN, transferLog(TOKEN, RECIPIENT, usdt("10")));

        VerificationResult result = verifier.verify(receipt, RECIPIENT, new BigDecimal("10"), TOLERANCE);

        assertThat(result.valid()).isTrue();
        assertThat(result.details().fromAddress()).isEqualTo(SENDER);
        assertThat(result.details().amountUsdt()).isEqualByComparingTo("10");
        assertThat(result.details().blockNumber()).isEqualTo(100L);
        assertThat(result.details().gasUsed()).isEqualTo(52_000L);
        assertThat(result.details().transactionHash()).isEqualTo(TX);
    }

    @ParameterizedTest(name = "expected 10, received {0} -> valid={1}")
    @CsvSource({
            "10.00, true",
            "9.995, true",
            "10.01, true",
            "9.99, true",
            "9.989, false",
            "10.011, false",
            "5, false"
    })
    void verify_amountTolerance(String received, boolean valid) {
        TransactionReceipt receipt = receipt(1, TOKEN, transferLog(TOKEN, RECIPIENT, usdt(received)));

        VerificationResult result = verifier.verify(receipt, RECIPIENT, new BigDecimal("10"), TOLERANCE);

        assertThat(result.valid()).isEqualTo(valid);
        if (!valid) {
            assertThat(result.reason()).startsWith(TransferVerifier.REASON_AMOUNT_MISMATCH);
        }
    }

    @Test
    void verify_recipientComparedCaseInsensitively() {
        TransactionReceipt receipt = receipt(1, TOKEN.toLowerCase(), transferLog(TOKEN, RECIPIENT.toLowerCase(), usdt("10")));

        assertThat(verifier.verify(receipt, RECIPIENT.toUpperCase().replace("0X", "0x"), new BigDecimal("10"), TOLERANCE).valid())
                .isTrue();
    }

    @Test
    void verify_reverted_isInvalidWhateverTheLogs() {
        TransactionReceipt receipt = receipt(0, TOKEN, transferLog(TOKEN, RECIPIENT, usdt("10")));

        VerificationResult result = verifier.verify(receipt, RECIPIENT, new BigDecimal("10"), TOLERANCE);

        assertThat(result.valid()).isFalse();
        assertThat(result.reason()).isEqualTo(TransferVerifier.REASON_REVERTED);
    }

    @Test
    void verify_callToOtherContract_isInvalid() {
        String otherToken = "0x" + "9".repeat(40);
        TransactionReceipt receipt = receipt(1, otherToken, transferLog(otherToken, RECIPIENT, usdt("10")));

        VerificationResult result = verifier.verify(receipt, RECIPIENT, new BigDecimal("10"), TOLERANCE);

        assertThat(result.valid()).isFalse();
        assertThat(result.reason()).startsWith(TransferVerifier.REASON_WRONG_CONTRACT);
    }

    @Test
    void verify_transferLogFromOtherContract_isIgnored() {
        TransactionReceipt receipt = receipt(1, TOKEN, transferLog("0x" + "9".repeat(40), RECIPIENT, usdt("10")));

        VerificationResult result = verifier.verify(receipt, RECIPIENT, new BigDecimal("10"), TOLERANCE);

        assertThat(result.valid()).isFalse();
        assertThat(result.reason()).isEqualTo(TransferVerifier.REASON_NO_TRANSFER);
    }

    @Test
    void verify_transferToSomeoneElse_isRecipientMismatch() {
        TransactionReceipt receipt = receipt(1, TOKEN, transferLog(TOKEN, "0x" + "3".repeat(40), usdt("10")));

        VerificationResult result = verifier.verify(receipt, RECIPIENT, new BigDecimal("10"), TOLERANCE);

        assertThat(result.valid()).isFalse();
        assertThat(result.reason()).startsWith(TransferVerifier.REASON_RECIPIENT_MISMATCH);
    }

    @Test
    void verify_batchTransfer_picksTheLegToRecipient() {
        TransactionReceipt receipt = receipt(1, TOKEN,
                transferLog(TOKEN, "0x" + "3".repeat(40), usdt("50")),
                transferLog(TOKEN, RECIPIENT, usdt("10")));

        VerificationResult result = verifier.verify(receipt, RECIPIENT, new BigDecimal("10"), TOLERANCE);

        assertThat(result.valid()).isTrue();
        assertThat(result.details().amountUsdt()).isEqualByComparingTo("10");
    }

    @Test
    void constructor_invalidContract_throws() {
        assertThatThrownBy(() -> new TransferVerifier("not-an-address", 18))
                .isInstanceOf(IllegalArgumentException.class);
    }

    private static BigInteger usdt(String amount) {
        return new BigDecimal(amount).movePointRight(18).toBigIntegerExact();
    }

    private static TransactionReceipt receipt(int status, String to, TransactionReceipt.Log... logs) {
        return new TransactionReceipt(TX, status, 100L, SENDER, to, 52_000L, List.of(logs));
    }

    private static TransactionReceipt.Log transferLog(String contract, String to, BigInteger value) {
        return new TransactionReceipt.Log(contract, List.of(
                TransferEvent.TRANSFER_TOPIC,
                "0x" + "0".repeat(24) + SENDER.substring(2),
                "0x" + "0".repeat(24) + to.substring(2).toLowerCase()),
                "0x" + value.toString(16),
                0L);
    }
}
