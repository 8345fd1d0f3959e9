package com.supplyradar.support;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.supplyradar.common.RetryPolicy;
import com.supplyradar.common.Sleeper;
import com.supplyradar.rpc.EvmRpcClient;
import com.supplyradar.rpc.RpcEndpoint;
import com.supplyradar.rpc.RpcTransport;
import io.github.resilience4j.ratelimiter.RateLimiter;
import io.github.resilience4j.ratelimiter.RateLimiterConfig;

import java.time.Duration;

public final class RpcTestSupport {

    public static final String TEST_URL = "https://test.rpc";

    private RpcTestSupport() {
    }

    public static RpcEndpoint endpoint(int maxAttempts, long delayMs) {
        return new RpcEndpoint(TEST_URL, Duration.ofSeconds(5), RetryPolicy.fixed(delayMs, maxAttempts));
    }

    public static RpcTransport transport(EvmRpcClient client, int maxAttempts, Sleeper sleeper) {
        return new RpcTransport(client, endpoint(maxAttempts, 1000L), fastLimiter(), sleeper, new ObjectMapper());
    }

    public static RateLimiter fastLimiter() {
        RateLimiterConfig config = RateLimiterConfig.custom()
                .limitRefreshPeriod(Duration.ofSeconds(1))
                .limitForPeriod(1_000_000)
                .timeoutDuration(Duration.ofMillis(1))
                .build();
        return RateLimiter.of("test-evm-fast-limiter", config);
    }

    /**
     * One permit per hour and no waiting: the second acquisition is always denied.
     */
    public static RateLimiter singlePermitLimiter() {
        RateLimiterConfig config = RateLimiterConfig.custom()
                .limitRefreshPeriod(Duration.ofHours(1))
                .limitForPeriod(1)
                .timeoutDuration(Duration.ZERO)
                .build();
        return RateLimiter.of("test-evm-single-permit", config);
    }
}
