package com.supplyradar.block;

import java.time.Instant;
import java.time.LocalDate;
import java.time.ZoneOffset;

/**
 * A resolved block: number and header timestamp.
 */
public record BlockRef(long number, Instant timestamp) {

    public BlockRef {
        if (number < 0) {
            throw new IllegalArgumentException("block number must not be negative: " + number);
        }
        if (timestamp == null) {
            throw new IllegalArgumentException("timestamp is required");
        }
    }

    /**
     * Calendar date of the block timestamp in UTC.
     */
    public LocalDate date() {
        return LocalDate.ofInstant(timestamp, ZoneOffset.UTC);
    }
}
