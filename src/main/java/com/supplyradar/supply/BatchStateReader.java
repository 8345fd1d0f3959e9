package com.supplyradar.supply;

import com.supplyradar.common.EthHex;
import com.supplyradar.common.RetryPolicy;
import com.supplyradar.common.Sleeper;
import com.supplyradar.rpc.RpcBatchResponse;
import com.supplyradar.rpc.RpcOutcome;
import com.supplyradar.rpc.RpcRequest;
import com.supplyradar.rpc.RpcTransport;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Reads a set of contract values at one block with a single JSON-RPC batch of eth_call requests.
 * <p>
 * Request id = query position. Error responses are read per {@link CallErrorPolicy}. If any value comes
 * back unavailable the whole batch is resent, up to the read policy's attempt budget; the last decoded
 * result is returned even if still incomplete.
 */
@Slf4j
@Component
public class BatchStateReader {

    private final RpcTransport transport;
    private final RetryPolicy readRetryPolicy;
    private final Sleeper sleeper;
    private final CallErrorPolicy callErrorPolicy;

    public BatchStateReader(
            RpcTransport transport,
            @Qualifier("batchReadRetryPolicy") RetryPolicy readRetryPolicy,
            Sleeper sleeper,
            CallErrorPolicy callErrorPolicy
    ) {
        this.transport = transport;
        this.readRetryPolicy = readRetryPolicy;
        this.sleeper = sleeper;
        this.callErrorPolicy = callErrorPolicy;
    }

    public QueryResult readAll(long blockNumber, List<SupplyQuery> queries) {
        List<RpcRequest> requests = buildRequests(blockNumber, queries);
        int maxAttempts = readRetryPolicy.getMaxAttempts();
        QueryResult result = null;
        for (int attempt = 0; attempt < maxAttempts; attempt++) {
            if (attempt > 0) {
                try {
                    sleeper.sleep(readRetryPolicy.delayMs(attempt - 1));
                } catch (InterruptedException e) {
                    Thread.currentThread().interrupt();
                    log.warn("Batch read at block {} interrupted; returning last result", blockNumber);
                    return result;
                }
            }
            result = readOnce(requests, queries);
            if (result.isComplete()) {
                return result;
            }
            log.warn("Batch read at block {}: {} of {} values unavailable (attempt {}/{})",
                    blockNumber, result.unavailableCount(), queries.size(), attempt + 1, maxAttempts);
        }
        return result;
    }

    private QueryResult readOnce(List<RpcRequest> requests, List<SupplyQuery> queries) {
        RpcOutcome<RpcBatchResponse> outcome = transport.executeBatch(requests);
        Map<String, QueryValue> values = new LinkedHashMap<>();
        for (int id = 0; id < queries.size(); id++) {
            String name = queries.get(id).name();
            if (outcome.isUnavailable()) {
                values.put(name, QueryValue.UNAVAILABLE);
                continue;
            }
            QueryValue value = outcome.get().find(id)
                    .map(response -> HexQuantityDecoder.decode(response, callErrorPolicy))
                    .orElse(QueryValue.UNAVAILABLE);
            values.put(name, value);
        }
        return new QueryResult(values);
    }

    private static List<RpcRequest> buildRequests(long blockNumber, List<SupplyQuery> queries) {
        if (queries == null || queries.isEmpty()) {
            throw new IllegalArgumentException("At least one query is required");
        }
        String blockTag = EthHex.toQuantity(blockNumber);
        Set<String> names = new HashSet<>();
        List<RpcRequest> requests = new ArrayList<>(queries.size());
        for (int i = 0; i < queries.size(); i++) {
            SupplyQuery query = queries.get(i);
            if (!names.add(query.name())) {
                throw new IllegalArgumentException("Duplicate query name: " + query.name());
            }
            Map<String, Object> call = new LinkedHashMap<>();
            call.put("to", query.contractAddress());
            call.put("data", query.callData());
            requests.add(RpcRequest.of(i, "eth_call", call, blockTag));
        }
        return requests;
    }
}
