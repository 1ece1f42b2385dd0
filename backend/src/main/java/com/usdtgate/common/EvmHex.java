package com.usdtgate.common;

import java.math.BigDecimal;
import java.math.BigInteger;
import java.math.RoundingMode;
import java.util.Locale;
import java.util.regex.Pattern;

/**
 * Hex helpers for EVM JSON-RPC payloads: quantities, 32-byte topics and ABI words.
 */
public final class EvmHex {

    private static final Pattern ADDRESS = Pattern.compile("^0x[0-9a-fA-F]{40}$");
    private static final Pattern TX_HASH = Pattern.compile("^0x[0-9a-fA-F]{64}$");

    private EvmHex() {
    }

    public static boolean isAddress(String value) {
        return value != null && ADDRESS.matcher(value.trim()).matches();
    }

    public static boolean isTransactionHash(String value) {
        return value != null && TX_HASH.matcher(value.trim()).matches();
    }

    /** Lowercase, trimmed form used for storage and comparisons; null stays null. */
    public static String normalizeAddress(String address) {
        return address == null ? null : address.trim().toLowerCase(Locale.ROOT);
    }

    public static boolean sameAddress(String a, String b) {
        return a != null && b != null && a.trim().equalsIgnoreCase(b.trim());
    }

    public static String toHexQuantity(long value) {
        return "0x" + Long.toHexString(value);
    }

    /** Parses a 0x-prefixed quantity; returns null for missing or malformed input. */
    public static Long parseQuantity(String hex) {
        if (hex == null || !hex.startsWith("0x") || hex.length() < 3) {
            return null;
        }
        try {
            return Long.parseLong(hex.substring(2), 16);
        } catch (NumberFormatException e) {
            return null;
        }
    }

    public static BigInteger parseBigInteger(String hex) {
        if (hex == null || hex.isBlank() || "0x".equals(hex)) {
            return BigInteger.ZERO;
        }
        String digits = hex.startsWith("0x") ? hex.substring(2) : hex;
        return new BigInteger(digits, 16);
    }

    /** Left-pads a 20-byte address into a 32-byte topic. */
    public static String padAddressForTopic(String address) {
        String hex = address.toLowerCase(Locale.ROOT).startsWith("0x") ? address.substring(2) : address;
        return "0x" + "0".repeat(24) + hex.toLowerCase(Locale.ROOT);
    }

    /** Last 20 bytes of a 32-byte topic, lowercase with 0x prefix. */
    public static String topicToAddress(String topic) {
        if (topic == null || topic.length() < 42) {
            return null;
        }
        return "0x" + topic.substring(topic.length() - 40).toLowerCase(Locale.ROOT);
    }

    /** Base units to decimal token amount. */
    public static BigDecimal toTokenAmount(BigInteger baseUnits, int decimals) {
        return new BigDecimal(baseUnits).divide(BigDecimal.TEN.pow(decimals), decimals, RoundingMode.HALF_UP);
    }
}
