package com.supplyradar.block;

import com.supplyradar.rpc.RpcOutcome;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.time.Instant;
import java.time.LocalDate;
import java.util.Optional;

/**
 * Resolves a calendar date (UTC) to a block by binary search over [0, head] using only block timestamps.
 * <p>
 * Returns the first probed block whose date equals the target, otherwise the last probed block dated
 * before the target. Among several blocks of the same day no particular one is guaranteed. Any
 * unavailable oracle read aborts the search with an empty result; nothing is carried between calls.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class BlockTimestampResolver {

    private final BlockOracle oracle;

    public Optional<BlockRef> resolve(LocalDate targetDate) {
        if (targetDate == null) {
            throw new IllegalArgumentException("targetDate is required");
        }
        RpcOutcome<Long> head = oracle.latestBlockNumber();
        if (head.isUnavailable()) {
            log.warn("Cannot resolve {}: latest block unavailable ({})", targetDate, head.reason());
            return Optional.empty();
        }

        long low = 0;
        long high = head.get();
        BlockRef candidate = null;
        while (low <= high) {
            long mid = low + (high - low) / 2;
            RpcOutcome<Instant> timestamp = oracle.blockTimestamp(mid);
            if (timestamp.isUnavailable()) {
                log.warn("Cannot resolve {}: block {} unavailable ({})", targetDate, mid, timestamp.reason());
                return Optional.empty();
            }
            BlockRef probe = new BlockRef(mid, timestamp.get());
            int cmp = probe.date().compareTo(targetDate);
            if (cmp == 0) {
                log.debug("Resolved {} to block {} (exact date)", targetDate, mid);
                return Optional.of(probe);
            }
            if (cmp < 0) {
                candidate = probe;
                low = mid + 1;
            } else {
                high = mid - 1;
            }
        }

        if (candidate == null) {
            log.warn("No block on or before {} (head {})", targetDate, head.get());
            return Optional.empty();
        }
        log.debug("Resolved {} to block {} dated {}", targetDate, candidate.number(), candidate.date());
        return Optional.of(candidate);
    }
}
