package com.supplyradar.rpc;

import com.fasterxml.jackson.databind.JsonNode;

/**
 * One JSON-RPC response object, tagged by shape.
 * <ul>
 *     <li>{@link Kind#RESULT}: integer id and no {@code error}; {@code result} may be JSON null or absent</li>
 *     <li>{@link Kind#ERROR}: integer id, {@code error} member present, no {@code result}</li>
 *     <li>{@link Kind#ANOMALY}: both members present, or no usable id</li>
 * </ul>
 *
 * @param id     response id, or null when missing or not an integer
 * @param result the {@code result} member for RESULT responses; null when absent or not a RESULT
 * @param error  the {@code error} member for ERROR responses, otherwise null
 */
public record RpcResponse(Integer id, Kind kind, JsonNode result, JsonNode error) {

    public enum Kind {
        RESULT,
        ERROR,
        ANOMALY
    }

    public static RpcResponse fromJson(JsonNode node) {
        if (node == null || !node.isObject()) {
            return new RpcResponse(null, Kind.ANOMALY, null, null);
        }
        JsonNode idNode = node.get("id");
        Integer id = idNode != null && idNode.canConvertToInt() && idNode.isIntegralNumber()
                ? idNode.intValue()
                : null;
        boolean hasResult = node.has("result");
        boolean hasError = node.has("error") && !node.get("error").isNull();
        if (id == null || (hasResult && hasError)) {
            return new RpcResponse(id, Kind.ANOMALY, null, null);
        }
        if (hasError) {
            return new RpcResponse(id, Kind.ERROR, null, node.get("error"));
        }
        return new RpcResponse(id, Kind.RESULT, node.get("result"), null);
    }

    public boolean isResult() {
        return kind == Kind.RESULT;
    }

    /**
     * Result as text when it is a JSON string; null for JSON null or a non-textual result.
     */
    public String resultText() {
        return result != null && result.isTextual() ? result.asText() : null;
    }

    /**
     * Short description for log lines.
     */
    public String describe() {
        return switch (kind) {
            case RESULT -> "result " + result;
            case ERROR -> "error " + error;
            case ANOMALY -> "malformed response (id=" + id + ")";
        };
    }
}
