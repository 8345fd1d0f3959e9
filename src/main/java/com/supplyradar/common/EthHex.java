package com.supplyradar.common;

import java.math.BigInteger;
import java.util.Optional;

/**
 * Hex quantity helpers for Ethereum JSON-RPC values ("0x"-prefixed, big-endian, unsigned).
 */
public final class EthHex {

    private EthHex() {
    }

    public static String toQuantity(long value) {
        if (value < 0) {
            throw new IllegalArgumentException("quantity must not be negative: " + value);
        }
        return "0x" + Long.toHexString(value);
    }

    /**
     * Parses an unsigned quantity. Empty when the value is null, lacks the 0x prefix, has no digits
     * or contains a non-hex character.
     */
    public static Optional<BigInteger> parseQuantity(String hex) {
        if (hex == null || !(hex.startsWith("0x") || hex.startsWith("0X"))) {
            return Optional.empty();
        }
        String digits = hex.substring(2);
        if (digits.isEmpty()) {
            return Optional.empty();
        }
        for (int i = 0; i < digits.length(); i++) {
            if (Character.digit(digits.charAt(i), 16) < 0) {
                return Optional.empty();
            }
        }
        return Optional.of(new BigInteger(digits, 16));
    }

    /**
     * Parses a quantity that must fit a non-negative long (block numbers, timestamps).
     */
    public static Optional<Long> parseLong(String hex) {
        return parseQuantity(hex)
                .filter(v -> v.bitLength() < 64)
                .map(BigInteger::longValue);
    }
}
