package com.supplyradar.rpc;

import reactor.core.publisher.Mono;

import java.util.List;

/**
 * EVM JSON-RPC HTTP client abstraction. One call = one HTTP POST; retries live in {@link RpcTransport}.
 */
public interface EvmRpcClient {

    /**
     * Perform a single JSON-RPC call.
     *
     * @param endpoint target endpoint (url and request timeout)
     * @param request  method, params and id, e.g. "eth_blockNumber"
     * @return response body as string (JSON object); errors with {@link RpcException} on HTTP failure or timeout
     */
    Mono<String> call(RpcEndpoint endpoint, RpcRequest request);

    /**
     * JSON-RPC batch call: send multiple requests in one HTTP request, keeping their caller-assigned ids.
     *
     * @param endpoint target endpoint (url and request timeout)
     * @param requests individual RPC requests to batch
     * @return response body as string (JSON array); errors with {@link RpcException} on HTTP failure or timeout
     */
    Mono<String> batchCall(RpcEndpoint endpoint, List<RpcRequest> requests);
}
