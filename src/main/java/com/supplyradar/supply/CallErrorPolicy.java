package com.supplyradar.supply;

/**
 * How a JSON-RPC error object returned for an eth_call is read.
 */
public enum CallErrorPolicy {

    /** The call carries no result, so it reads as zero (reverted call at a block before deployment). */
    ZERO,

    /** The value is unavailable and the batch is resent while read attempts remain. */
    UNAVAILABLE
}
