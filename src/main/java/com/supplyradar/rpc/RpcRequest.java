package com.supplyradar.rpc;

import java.util.List;

/**
 * A single JSON-RPC request. The id is caller-assigned and must be unique within one batch.
 */
public record RpcRequest(int id, String method, List<Object> params) {

    public RpcRequest {
        if (method == null || method.isBlank()) {
            throw new IllegalArgumentException("method is required");
        }
        params = params != null ? List.copyOf(params) : List.of();
    }

    public static RpcRequest of(int id, String method, Object... params) {
        return new RpcRequest(id, method, List.of(params));
    }
}
