package com.supplyradar.rpc;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.supplyradar.common.RetryPolicy;
import com.supplyradar.common.Sleeper;
import io.github.resilience4j.ratelimiter.RateLimiter;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Component;

import java.util.HashSet;
import java.util.List;
import java.util.Set;
import java.util.function.Supplier;

/**
 * Executes single and batched JSON-RPC calls against one {@link RpcEndpoint} with a bounded number of
 * attempts and a delay between them. Transport failures never propagate: after the last attempt the
 * outcome is {@link RpcOutcome#unavailable(String)}.
 */
@Slf4j
@Component
public class RpcTransport {

    private final EvmRpcClient rpcClient;
    private final RpcEndpoint endpoint;
    private final RateLimiter rateLimiter;
    private final Sleeper sleeper;
    private final ObjectMapper objectMapper;

    public RpcTransport(
            EvmRpcClient rpcClient,
            RpcEndpoint endpoint,
            @Qualifier("evmRpcRateLimiter") RateLimiter rateLimiter,
            Sleeper sleeper,
            ObjectMapper objectMapper
    ) {
        this.rpcClient = rpcClient;
        this.endpoint = endpoint;
        this.rateLimiter = rateLimiter;
        this.sleeper = sleeper;
        this.objectMapper = objectMapper;
    }

    /**
     * One request, one HTTP call per attempt. A JSON-RPC error object is a valid response
     * ({@link RpcResponse.Kind#ERROR}), not a failed attempt.
     */
    public RpcOutcome<RpcResponse> execute(RpcRequest request) {
        return withRetry(request.method(), () -> {
            JsonNode root = readBody(rpcClient.call(endpoint, request).block());
            if (!root.isObject()) {
                throw new RpcException("Expected JSON object, got " + root.getNodeType());
            }
            return RpcResponse.fromJson(root);
        });
    }

    /**
     * All requests in one HTTP call per attempt. Responses are correlated by id; a body that is not a
     * JSON array counts as a failed attempt.
     *
     * @throws IllegalArgumentException when requests is empty or ids repeat
     */
    public RpcOutcome<RpcBatchResponse> executeBatch(List<RpcRequest> requests) {
        if (requests == null || requests.isEmpty()) {
            throw new IllegalArgumentException("Batch must contain at least one request");
        }
        Set<Integer> ids = new HashSet<>();
        for (RpcRequest request : requests) {
            if (!ids.add(request.id())) {
                throw new IllegalArgumentException("Duplicate request id in batch: " + request.id());
            }
        }
        String label = "batch " + requests.get(0).method() + " (" + requests.size() + " req)";
        RpcOutcome<RpcBatchResponse> outcome = withRetry(label, () -> {
            JsonNode root = readBody(rpcClient.batchCall(endpoint, requests).block());
            if (!root.isArray()) {
                throw new RpcException("Expected JSON array for batch, got " + root.getNodeType());
            }
            return RpcBatchResponse.correlate(ids, root);
        });
        outcome.value()
                .filter(RpcBatchResponse::hasAnomalies)
                .ifPresent(batch -> log.warn("RPC {} protocol anomalies: missing ids {}, {} duplicate, {} unmatched",
                        label, batch.getMissingIds(), batch.getDuplicateIds(), batch.getUnmatchedIds()));
        return outcome;
    }

    public RpcEndpoint getEndpoint() {
        return endpoint;
    }

    private <T> RpcOutcome<T> withRetry(String label, Supplier<T> attempt) {
        RetryPolicy policy = endpoint.retryPolicy();
        int maxAttempts = policy.getMaxAttempts();
        String lastReason = "no attempt made";
        for (int i = 0; i < maxAttempts; i++) {
            if (i > 0) {
                try {
                    sleeper.sleep(policy.delayMs(i - 1));
                } catch (InterruptedException e) {
                    Thread.currentThread().interrupt();
                    log.warn("RPC {} interrupted while waiting to retry", label);
                    return RpcOutcome.unavailable("interrupted after " + i + " attempts: " + lastReason);
                }
            }
            try {
                acquirePermit(label);
                return RpcOutcome.available(attempt.get());
            } catch (RuntimeException e) {
                lastReason = messageOf(e);
                log.warn("RPC {} failed (attempt {}/{}): {}", label, i + 1, maxAttempts, lastReason);
            }
        }
        log.warn("RPC {} unavailable after {} attempts on {}", label, maxAttempts, endpoint.url());
        return RpcOutcome.unavailable(label + " failed after " + maxAttempts + " attempts: " + lastReason);
    }

    private void acquirePermit(String label) {
        if (!rateLimiter.acquirePermission()) {
            throw new RpcException("Local rate limiter timeout before " + label);
        }
    }

    private JsonNode readBody(String body) {
        if (body == null || body.isBlank()) {
            throw new RpcException("Empty RPC response body");
        }
        try {
            return objectMapper.readTree(body);
        } catch (JsonProcessingException e) {
            throw new RpcException("Unparseable RPC response body", e);
        }
    }

    private static String messageOf(Exception e) {
        if (e.getMessage() == null || e.getMessage().isBlank()) {
            return e.getClass().getSimpleName();
        }
        return e.getMessage();
    }
}
