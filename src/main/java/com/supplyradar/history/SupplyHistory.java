package com.supplyradar.history;

import java.time.LocalDate;
import java.util.List;

/**
 * Result of a date range collection: one snapshot per resolved date, plus the dates that were skipped.
 */
public record SupplyHistory(LocalDate from, LocalDate to, List<SupplySnapshot> snapshots, List<SkippedDate> skipped) {

    public SupplyHistory {
        snapshots = List.copyOf(snapshots);
        skipped = List.copyOf(skipped);
    }
}
