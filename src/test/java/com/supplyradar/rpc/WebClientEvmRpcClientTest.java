package com.supplyradar.rpc;

import com.supplyradar.common.RetryPolicy;
import org.junit.jupiter.api.Test;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpMethod;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.web.reactive.function.client.ClientRequest;
import org.springframework.web.reactive.function.client.ClientResponse;
import org.springframework.web.reactive.function.client.WebClient;
import org.springframework.web.reactive.function.client.WebClientRequestException;
import reactor.core.publisher.Mono;

import java.net.ConnectException;
import java.net.URI;
import java.time.Duration;
import java.util.List;
import java.util.concurrent.atomic.AtomicReference;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class WebClientEvmRpcClientTest {

    private static final RpcEndpoint ENDPOINT =
            new RpcEndpoint("https://test.rpc", Duration.ofMillis(200), RetryPolicy.fixed(10L, 1));

    @Test
    void call_postsJsonAndReturnsBody() {
        AtomicReference<ClientRequest> sent = new AtomicReference<>();
        WebClientEvmRpcClient client = new WebClientEvmRpcClient(WebClient.builder().exchangeFunction(request -> {
            sent.set(request);
            return Mono.just(ClientResponse.create(HttpStatus.OK)
                    .header(HttpHeaders.CONTENT_TYPE, MediaType.APPLICATION_JSON_VALUE)
                    .body("{\"jsonrpc\":\"2.0\",\"id\":1,\"result\":\"0x10\"}")
                    .build());
        }));

        String body = client.call(ENDPOINT, RpcRequest.of(1, "eth_blockNumber")).block();

        assertThat(body).contains("\"result\":\"0x10\"");
        assertThat(sent.get().method()).isEqualTo(HttpMethod.POST);
        assertThat(sent.get().url().toString()).isEqualTo("https://test.rpc");
        assertThat(sent.get().headers().getContentType()).isEqualTo(MediaType.APPLICATION_JSON);
    }

    @Test
    void batchCall_non2xx_mappedToRpcException() {
        WebClientEvmRpcClient client = new WebClientEvmRpcClient(WebClient.builder().exchangeFunction(request ->
                Mono.just(ClientResponse.create(HttpStatus.SERVICE_UNAVAILABLE).build())));

        assertThatThrownBy(() -> client.batchCall(ENDPOINT, List.of(RpcRequest.of(0, "eth_call"))).block())
                .isInstanceOf(RpcException.class)
                .hasMessage("HTTP 503 from https://test.rpc");
    }

    @Test
    void call_connectionRefused_mappedToRpcException() {
        WebClientEvmRpcClient client = new WebClientEvmRpcClient(WebClient.builder().exchangeFunction(request ->
                Mono.error(new WebClientRequestException(new ConnectException("Connection refused"),
                        HttpMethod.POST, URI.create("https://test.rpc"), new HttpHeaders()))));

        assertThatThrownBy(() -> client.call(ENDPOINT, RpcRequest.of(1, "eth_blockNumber")).block())
                .isInstanceOf(RpcException.class)
                .hasMessageStartingWith("Request to https://test.rpc failed")
                .hasMessageContaining("Connection refused")
                .hasRootCauseInstanceOf(ConnectException.class);
    }

    @Test
    void call_noResponse_timesOut() {
        WebClientEvmRpcClient client = new WebClientEvmRpcClient(WebClient.builder()
                .exchangeFunction(request -> Mono.never()));

        assertThatThrownBy(() -> client.call(ENDPOINT, RpcRequest.of(1, "eth_blockNumber")).block())
                .isInstanceOf(RpcException.class)
                .hasMessage("Timed out after 200 ms");
    }
}
