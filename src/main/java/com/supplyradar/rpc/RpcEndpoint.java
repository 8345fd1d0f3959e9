package com.supplyradar.rpc;

import com.supplyradar.common.RetryPolicy;

import java.time.Duration;

/**
 * One JSON-RPC target with its per-request timeout and retry budget. Immutable; safe to share
 * between threads.
 */
public record RpcEndpoint(String url, Duration requestTimeout, RetryPolicy retryPolicy) {

    public RpcEndpoint {
        if (url == null || url.isBlank()) {
            throw new IllegalArgumentException("RPC endpoint url is required");
        }
        if (requestTimeout == null || requestTimeout.isZero() || requestTimeout.isNegative()) {
            throw new IllegalArgumentException("requestTimeout must be positive");
        }
        if (retryPolicy == null) {
            retryPolicy = RetryPolicy.defaultPolicy();
        }
        url = url.trim();
    }

    public static RpcEndpoint of(String url) {
        return new RpcEndpoint(url, Duration.ofSeconds(10), RetryPolicy.defaultPolicy());
    }

    @Override
    public String toString() {
        return "RpcEndpoint[" + url + ", timeout=" + requestTimeout + ", " + retryPolicy + "]";
    }
}
