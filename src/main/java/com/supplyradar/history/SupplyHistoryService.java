package com.supplyradar.history;

import com.supplyradar.block.BlockRef;
import com.supplyradar.block.BlockTimestampResolver;
import com.supplyradar.config.HistoryProperties;
import com.supplyradar.config.SupplyReaderProperties;
import com.supplyradar.supply.BatchStateReader;
import com.supplyradar.supply.QueryResult;
import com.supplyradar.supply.SupplyQuery;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.math.BigDecimal;
import java.time.Clock;
import java.time.LocalDate;
import java.time.temporal.ChronoUnit;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Walks a date range one day at a time: resolve the day's block, read every configured token at it,
 * scale raw values by decimals. A day that cannot be resolved is skipped; it never stops the run.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class SupplyHistoryService {

    private final BlockTimestampResolver blockResolver;
    private final BatchStateReader stateReader;
    private final SupplyReaderProperties readerProperties;
    private final HistoryProperties historyProperties;
    private final Clock clock;

    public List<SupplyQuery> configuredQueries() {
        return readerProperties.toQueries();
    }

    /**
     * Missing {@code to} means today (UTC); missing {@code from} means {@code defaultRangeDays} before {@code to}.
     */
    public SupplyHistory collectWithDefaults(LocalDate from, LocalDate to) {
        LocalDate end = to != null ? to : LocalDate.now(clock);
        LocalDate start = from != null ? from : end.minusDays(historyProperties.getDefaultRangeDays());
        return collect(start, end);
    }

    /**
     * @throws IllegalArgumentException when the range is reversed, too long, or no tokens are configured
     */
    public SupplyHistory collect(LocalDate from, LocalDate to) {
        validateRange(from, to);
        List<SupplyQuery> queries = configuredQueries();
        if (queries.isEmpty()) {
            throw new IllegalArgumentException("No tokens configured under supplyradar.reader.tokens");
        }
        List<SupplySnapshot> snapshots = new ArrayList<>();
        List<SkippedDate> skipped = new ArrayList<>();
        for (LocalDate date = from; !date.isAfter(to); date = date.plusDays(1)) {
            log.info("Fetching supplies for {}", date);
            Optional<BlockRef> block = blockResolver.resolve(date);
            if (block.isEmpty()) {
                log.warn("No block found for {}, skipping", date);
                skipped.add(new SkippedDate(date, SkippedDate.Reason.NO_BLOCK));
                continue;
            }
            QueryResult result = stateReader.readAll(block.get().number(), queries);
            if (!result.isComplete() && historyProperties.isSkipIncompleteDates()) {
                log.warn("Skipping {}: {} supplies unavailable at block {}",
                        date, result.unavailableCount(), block.get().number());
                skipped.add(new SkippedDate(date, SkippedDate.Reason.INCOMPLETE_READ));
                continue;
            }
            snapshots.add(toSnapshot(date, block.get(), queries, result));
        }
        return new SupplyHistory(from, to, snapshots, skipped);
    }

    private void validateRange(LocalDate from, LocalDate to) {
        if (from == null || to == null) {
            throw new IllegalArgumentException("from and to are required");
        }
        if (from.isAfter(to)) {
            throw new IllegalArgumentException("from must not be after to");
        }
        long days = ChronoUnit.DAYS.between(from, to) + 1;
        if (days > historyProperties.getMaxRangeDays()) {
            throw new IllegalArgumentException("Range of " + days + " days exceeds the maximum of "
                    + historyProperties.getMaxRangeDays());
        }
    }

    private static SupplySnapshot toSnapshot(LocalDate date, BlockRef block, List<SupplyQuery> queries, QueryResult result) {
        Map<String, BigDecimal> supplies = new LinkedHashMap<>();
        for (SupplyQuery query : queries) {
            supplies.put(query.name(), result.get(query.name()).scaled(query.decimals()).orElse(null));
        }
        return new SupplySnapshot(date, block.number(), block.timestamp(), supplies);
    }
}
