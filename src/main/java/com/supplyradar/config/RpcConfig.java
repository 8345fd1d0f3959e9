package com.supplyradar.config;

import com.supplyradar.common.RetryPolicy;
import com.supplyradar.common.Sleeper;
import com.supplyradar.rpc.EvmRpcClient;
import com.supplyradar.rpc.RpcEndpoint;
import com.supplyradar.rpc.WebClientEvmRpcClient;
import com.supplyradar.supply.CallErrorPolicy;
import io.github.resilience4j.ratelimiter.RateLimiter;
import io.github.resilience4j.ratelimiter.RateLimiterConfig;
import io.netty.channel.ChannelOption;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.http.client.reactive.ReactorClientHttpConnector;
import org.springframework.web.reactive.function.client.WebClient;
import reactor.netty.http.client.HttpClient;

import java.time.Duration;

/**
 * Builds the immutable {@link RpcEndpoint}, HTTP client, rate limiter and retry policies from
 * supplyradar.* properties. Nothing downstream reads properties directly.
 */
@Configuration
@EnableConfigurationProperties({ RpcEndpointProperties.class, SupplyReaderProperties.class, HistoryProperties.class })
public class RpcConfig {

    @Bean
    public RpcEndpoint rpcEndpoint(RpcEndpointProperties properties) {
        RetryPolicy policy = new RetryPolicy(
                properties.getRetryDelayMs(),
                properties.getJitterFactor(),
                properties.getMaxAttempts(),
                properties.isExponentialBackoff());
        return new RpcEndpoint(properties.getUrl(), Duration.ofMillis(properties.getRequestTimeoutMs()), policy);
    }

    @Bean(name = "batchReadRetryPolicy")
    public RetryPolicy batchReadRetryPolicy(SupplyReaderProperties properties) {
        return RetryPolicy.fixed(properties.getRetryDelayMs(), properties.getMaxAttempts());
    }

    @Bean
    public CallErrorPolicy callErrorPolicy(SupplyReaderProperties properties) {
        return properties.getCallErrorPolicy();
    }

    @Bean
    public Sleeper retrySleeper() {
        return Sleeper.THREAD_SLEEP;
    }

    @Bean
    public EvmRpcClient evmRpcClient(ObjectProvider<WebClient.Builder> webClientBuilder, RpcEndpointProperties properties) {
        HttpClient httpClient = HttpClient.create()
                .option(ChannelOption.CONNECT_TIMEOUT_MILLIS, properties.getConnectTimeoutMs());
        WebClient.Builder builder = webClientBuilder.getIfAvailable(WebClient::builder)
                .clientConnector(new ReactorClientHttpConnector(httpClient))
                .codecs(codecs -> codecs.defaultCodecs().maxInMemorySize(properties.getMaxResponseBytes()));
        return new WebClientEvmRpcClient(builder);
    }

    @Bean(name = "evmRpcRateLimiter")
    public RateLimiter evmRpcRateLimiter(RpcEndpointProperties properties) {
        RateLimiterConfig config = RateLimiterConfig.custom()
                .limitRefreshPeriod(Duration.ofSeconds(1))
                .limitForPeriod(Math.max(1, properties.getMaxRequestsPerSecond()))
                .timeoutDuration(Duration.ofMillis(Math.max(0L, properties.getLocalLimiterTimeoutMs())))
                .build();
        return RateLimiter.of("evm-rpc", config);
    }
}
