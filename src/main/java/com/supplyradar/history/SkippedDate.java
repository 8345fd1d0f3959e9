package com.supplyradar.history;

import java.time.LocalDate;

/**
 * A date left out of the history, with the reason.
 */
public record SkippedDate(LocalDate date, Reason reason) {

    public enum Reason {
        /** No block dated on or before the day could be resolved. */
        NO_BLOCK,
        /** Some values stayed unavailable after every batch attempt. */
        INCOMPLETE_READ
    }
}
