package com.supplyradar.rpc;

import org.springframework.http.MediaType;
import org.springframework.web.reactive.function.client.WebClient;
import org.springframework.web.reactive.function.client.WebClientRequestException;
import org.springframework.web.reactive.function.client.WebClientResponseException;
import reactor.core.publisher.Mono;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.TimeoutException;

/**
 * EVM JSON-RPC client using WebClient. Non-2xx statuses, connection failures and timeouts all surface
 * as {@link RpcException}.
 */
public class WebClientEvmRpcClient implements EvmRpcClient {

    private final WebClient webClient;

    public WebClientEvmRpcClient(WebClient.Builder builder) {
        this.webClient = builder.build();
    }

    @Override
    public Mono<String> call(RpcEndpoint endpoint, RpcRequest request) {
        return post(endpoint, envelope(request));
    }

    @Override
    public Mono<String> batchCall(RpcEndpoint endpoint, List<RpcRequest> requests) {
        List<Map<String, Object>> batch = requests.stream()
                .map(WebClientEvmRpcClient::envelope)
                .toList();
        return post(endpoint, batch);
    }

    private Mono<String> post(RpcEndpoint endpoint, Object body) {
        return webClient.post()
                .uri(endpoint.url())
                .contentType(MediaType.APPLICATION_JSON)
                .accept(MediaType.APPLICATION_JSON)
                .bodyValue(body)
                .retrieve()
                .bodyToMono(String.class)
                .timeout(endpoint.requestTimeout())
                .onErrorMap(WebClientResponseException.class,
                        e -> new RpcException("HTTP " + e.getStatusCode().value() + " from " + endpoint.url(), e))
                .onErrorMap(WebClientRequestException.class,
                        e -> new RpcException("Request to " + endpoint.url() + " failed: " + e.getMessage(), e))
                .onErrorMap(TimeoutException.class,
                        e -> new RpcException("Timed out after " + endpoint.requestTimeout().toMillis() + " ms", e));
    }

    private static Map<String, Object> envelope(RpcRequest request) {
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("jsonrpc", "2.0");
        body.put("method", request.method());
        body.put("params", request.params());
        body.put("id", request.id());
        return body;
    }
}
