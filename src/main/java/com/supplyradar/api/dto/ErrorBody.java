package com.supplyradar.api.dto;

import java.time.Instant;

/**
 * Body of every 400 from the supply endpoints: an unparseable date, a reversed or too long range, or an
 * empty token table. {@code error} is the machine-readable code (INVALID_REQUEST).
 */
public record ErrorBody(String error, String message, Instant timestamp) {

    /**
     * Creates an error body with timestamp set to now (UTC).
     */
    public static ErrorBody of(String error, String message) {
        return new ErrorBody(error, message, Instant.now());
    }
}
