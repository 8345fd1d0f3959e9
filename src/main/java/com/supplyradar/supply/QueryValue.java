package com.supplyradar.supply;

import java.math.BigDecimal;
import java.math.BigInteger;
import java.util.Objects;
import java.util.Optional;

/**
 * Raw unsigned integer read from a contract, or {@link #UNAVAILABLE} when it could not be decoded.
 * Zero is a value, never a stand-in for unavailable.
 */
public final class QueryValue {

    public static final QueryValue UNAVAILABLE = new QueryValue(null);
    private static final QueryValue ZERO = new QueryValue(BigInteger.ZERO);

    private final BigInteger raw;

    private QueryValue(BigInteger raw) {
        this.raw = raw;
    }

    public static QueryValue of(BigInteger raw) {
        Objects.requireNonNull(raw, "raw");
        if (raw.signum() < 0) {
            throw new IllegalArgumentException("raw value must be unsigned: " + raw);
        }
        return raw.signum() == 0 ? ZERO : new QueryValue(raw);
    }

    public static QueryValue zero() {
        return ZERO;
    }

    public boolean isUnavailable() {
        return raw == null;
    }

    public Optional<BigInteger> getRaw() {
        return Optional.ofNullable(raw);
    }

    /**
     * raw / 10^decimals, exact. Empty when unavailable.
     */
    public Optional<BigDecimal> scaled(int decimals) {
        return getRaw().map(v -> new BigDecimal(v, decimals));
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof QueryValue other)) {
            return false;
        }
        return Objects.equals(raw, other.raw);
    }

    @Override
    public int hashCode() {
        return Objects.hashCode(raw);
    }

    @Override
    public String toString() {
        return raw == null ? "UNAVAILABLE" : raw.toString();
    }
}
