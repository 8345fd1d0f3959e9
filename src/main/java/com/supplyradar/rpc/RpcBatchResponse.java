package com.supplyradar.rpc;

import com.fasterxml.jackson.databind.JsonNode;

import java.util.Collections;
import java.util.HashMap;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.TreeSet;

/**
 * Responses of one batch call indexed by request id. Position in the wire array carries no meaning.
 */
public final class RpcBatchResponse {

    private final Map<Integer, RpcResponse> byId;
    private final Set<Integer> missingIds;
    private final int duplicateIds;
    private final int unmatchedIds;

    private RpcBatchResponse(Map<Integer, RpcResponse> byId, Set<Integer> missingIds, int duplicateIds, int unmatchedIds) {
        this.byId = Collections.unmodifiableMap(byId);
        this.missingIds = Collections.unmodifiableSet(missingIds);
        this.duplicateIds = duplicateIds;
        this.unmatchedIds = unmatchedIds;
    }

    /**
     * Correlates a JSON array of responses with the submitted ids. The first response for an id wins;
     * later duplicates and ids that were never submitted (or are missing) are counted as anomalies.
     */
    static RpcBatchResponse correlate(Set<Integer> submittedIds, JsonNode responses) {
        Map<Integer, RpcResponse> byId = new HashMap<>();
        int duplicates = 0;
        int unmatched = 0;
        for (JsonNode node : responses) {
            RpcResponse response = RpcResponse.fromJson(node);
            Integer id = response.id();
            if (id == null || !submittedIds.contains(id)) {
                unmatched++;
                continue;
            }
            if (byId.putIfAbsent(id, response) != null) {
                duplicates++;
            }
        }
        Set<Integer> missing = new TreeSet<>(submittedIds);
        missing.removeAll(byId.keySet());
        return new RpcBatchResponse(byId, missing, duplicates, unmatched);
    }

    public Optional<RpcResponse> find(int id) {
        return Optional.ofNullable(byId.get(id));
    }

    public int size() {
        return byId.size();
    }

    public Set<Integer> getMissingIds() {
        return missingIds;
    }

    public int getDuplicateIds() {
        return duplicateIds;
    }

    public int getUnmatchedIds() {
        return unmatchedIds;
    }

    public boolean hasAnomalies() {
        return !missingIds.isEmpty() || duplicateIds > 0 || unmatchedIds > 0;
    }
}
