package com.supplyradar.config;

import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

/**
 * JSON-RPC endpoint, timeouts, retry schedule and local request budget. Documented in application.yml.
 */
@ConfigurationProperties(prefix = "supplyradar.rpc")
@Validated
@NoArgsConstructor
@Getter
@Setter
public class RpcEndpointProperties {

    /** JSON-RPC HTTP endpoint. */
    @NotBlank
    private String url;

    /** Per-request timeout (whole HTTP exchange). Default 10s. */
    @Min(1)
    private long requestTimeoutMs = 10_000L;

    /** TCP connect timeout. Default 5s. */
    @Min(1)
    private int connectTimeoutMs = 5_000;

    /** Attempts per physical call, including the first one. Default 3. */
    @Min(1)
    private int maxAttempts = 3;

    /** Delay between attempts. Default 1000. */
    @Min(0)
    private long retryDelayMs = 1_000L;

    /** Double the delay after each failed attempt instead of keeping it fixed. */
    private boolean exponentialBackoff = false;

    /** Jitter factor 0..1 (e.g. 0.2 = ±20%). Default 0 (exact delays). */
    private double jitterFactor = 0.0;

    /** Local RPC budget (requests per second) for this service instance. */
    @Min(1)
    private int maxRequestsPerSecond = 25;

    /** How long the local limiter may wait for a permit before the attempt counts as failed. */
    @Min(0)
    private long localLimiterTimeoutMs = 2_000L;

    /** Upper bound for buffered response bodies (large batches). Default 4 MiB. */
    @Min(1)
    private int maxResponseBytes = 4 * 1024 * 1024;
}
