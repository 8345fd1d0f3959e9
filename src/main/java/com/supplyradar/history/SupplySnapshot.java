package com.supplyradar.history;

import java.math.BigDecimal;
import java.time.Instant;
import java.time.LocalDate;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Scaled supplies for one date at its resolved block. A null supply means the value was unavailable.
 */
public record SupplySnapshot(LocalDate date, long block, Instant blockTimestamp, Map<String, BigDecimal> supplies) {

    public SupplySnapshot {
        supplies = Collections.unmodifiableMap(new LinkedHashMap<>(supplies));
    }
}
