package com.supplyradar.block;

import com.supplyradar.rpc.RpcOutcome;

import java.time.Instant;

/**
 * Chain metadata reads that drive date-to-block resolution.
 */
public interface BlockOracle {

    /**
     * Current head block number.
     */
    RpcOutcome<Long> latestBlockNumber();

    /**
     * Header timestamp of the given block.
     */
    RpcOutcome<Instant> blockTimestamp(long blockNumber);
}
