package com.supplyradar.rpc;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.supplyradar.support.RecordingSleeper;
import com.supplyradar.support.RpcTestSupport;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import reactor.core.publisher.Mono;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyList;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class RpcTransportTest {

    private static final RpcRequest BLOCK_NUMBER = RpcRequest.of(1, "eth_blockNumber");

    @Mock
    private EvmRpcClient rpcClient;

    private RecordingSleeper sleeper;
    private RpcTransport transport;

    @BeforeEach
    void setUp() {
        sleeper = new RecordingSleeper();
        transport = RpcTestSupport.transport(rpcClient, 3, sleeper);
    }

    @Test
    void execute_success_firstAttempt_noDelay() {
        when(rpcClient.call(any(), any())).thenReturn(Mono.just("{\"jsonrpc\":\"2.0\",\"id\":1,\"result\":\"0x64\"}"));

        RpcOutcome<RpcResponse> outcome = transport.execute(BLOCK_NUMBER);

        assertThat(outcome.isAvailable()).isTrue();
        assertThat(outcome.get().resultText()).isEqualTo("0x64");
        assertThat(sleeper.getDelays()).isEmpty();
    }

    @Test
    @DisplayName("transport failures are retried with a fixed delay, then succeed")
    void execute_failsTwiceThenSucceeds() {
        when(rpcClient.call(any(), any()))
                .thenReturn(Mono.error(new RpcException("HTTP 503 from https://test.rpc")))
                .thenReturn(Mono.error(new RpcException("Timed out after 5000 ms")))
                .thenReturn(Mono.just("{\"jsonrpc\":\"2.0\",\"id\":1,\"result\":\"0x64\"}"));

        RpcOutcome<RpcResponse> outcome = transport.execute(BLOCK_NUMBER);

        assertThat(outcome.isAvailable()).isTrue();
        assertThat(sleeper.getDelays()).containsExactly(1000L, 1000L);
        verify(rpcClient, times(3)).call(any(), any());
    }

    @Test
    @DisplayName("all attempts failing yields unavailable, never an exception")
    void execute_allAttemptsFail_unavailable() {
        when(rpcClient.call(any(), any())).thenReturn(Mono.error(new RpcException("connection refused")));

        RpcOutcome<RpcResponse> outcome = transport.execute(BLOCK_NUMBER);

        assertThat(outcome.isUnavailable()).isTrue();
        assertThat(outcome.reason()).contains("3 attempts").contains("connection refused");
        assertThat(sleeper.getDelays()).hasSize(2);
        verify(rpcClient, times(3)).call(any(), any());
    }

    @Test
    void execute_unparseableOrEmptyBody_countsAsFailedAttempt() {
        when(rpcClient.call(any(), any()))
                .thenReturn(Mono.just("<html>bad gateway</html>"))
                .thenReturn(Mono.empty())
                .thenReturn(Mono.just("[]"));

        RpcOutcome<RpcResponse> outcome = transport.execute(BLOCK_NUMBER);

        assertThat(outcome.isUnavailable()).isTrue();
        verify(rpcClient, times(3)).call(any(), any());
    }

    @Test
    @DisplayName("JSON-RPC error object is a response, not a transport failure")
    void execute_jsonRpcError_notRetried() {
        when(rpcClient.call(any(), any()))
                .thenReturn(Mono.just("{\"jsonrpc\":\"2.0\",\"id\":1,\"error\":{\"code\":-32601,\"message\":\"nope\"}}"));

        RpcOutcome<RpcResponse> outcome = transport.execute(BLOCK_NUMBER);

        assertThat(outcome.isAvailable()).isTrue();
        assertThat(outcome.get().kind()).isEqualTo(RpcResponse.Kind.ERROR);
        verify(rpcClient, times(1)).call(any(), any());
    }

    @Test
    void execute_rateLimiterDenied_countsAsFailedAttempt() {
        RpcTransport limited = new RpcTransport(rpcClient, RpcTestSupport.endpoint(2, 10L),
                RpcTestSupport.singlePermitLimiter(), sleeper, new ObjectMapper());
        when(rpcClient.call(any(), any())).thenReturn(Mono.error(new RpcException("HTTP 429 from https://test.rpc")));

        RpcOutcome<RpcResponse> outcome = limited.execute(BLOCK_NUMBER);

        assertThat(outcome.isUnavailable()).isTrue();
        assertThat(outcome.reason()).contains("rate limiter");
        verify(rpcClient, times(1)).call(any(), any());
    }

    @Test
    @DisplayName("batch responses are correlated by id regardless of order")
    void executeBatch_reordered_correlatedById() {
        List<RpcRequest> requests = List.of(
                RpcRequest.of(0, "eth_call", "a"),
                RpcRequest.of(1, "eth_call", "b"),
                RpcRequest.of(2, "eth_call", "c"));
        when(rpcClient.batchCall(any(), anyList())).thenReturn(Mono.just("""
                [{"jsonrpc":"2.0","id":2,"result":"0x3"},
                 {"jsonrpc":"2.0","id":0,"result":"0x1"},
                 {"jsonrpc":"2.0","id":1,"result":"0x2"}]
                """));

        RpcBatchResponse batch = transport.executeBatch(requests).get();

        assertThat(batch.find(0)).get().extracting(RpcResponse::resultText).isEqualTo("0x1");
        assertThat(batch.find(1)).get().extracting(RpcResponse::resultText).isEqualTo("0x2");
        assertThat(batch.find(2)).get().extracting(RpcResponse::resultText).isEqualTo("0x3");
        assertThat(batch.hasAnomalies()).isFalse();
    }

    @Test
    @DisplayName("duplicate, unmatched and missing ids are anomalies that do not abort the batch")
    void executeBatch_anomalies_counted() {
        List<RpcRequest> requests = List.of(
                RpcRequest.of(0, "eth_call", "a"),
                RpcRequest.of(1, "eth_call", "b"),
                RpcRequest.of(2, "eth_call", "c"));
        when(rpcClient.batchCall(any(), anyList())).thenReturn(Mono.just("""
                [{"jsonrpc":"2.0","id":0,"result":"0x1"},
                 {"jsonrpc":"2.0","id":0,"result":"0x9"},
                 {"jsonrpc":"2.0","id":7,"result":"0x7"},
                 {"jsonrpc":"2.0","id":1,"result":"0x2"}]
                """));

        RpcOutcome<RpcBatchResponse> outcome = transport.executeBatch(requests);

        RpcBatchResponse batch = outcome.get();
        assertThat(batch.find(0)).get().extracting(RpcResponse::resultText).isEqualTo("0x1");
        assertThat(batch.find(1)).isPresent();
        assertThat(batch.find(2)).isEmpty();
        assertThat(batch.getMissingIds()).containsExactly(2);
        assertThat(batch.getDuplicateIds()).isEqualTo(1);
        assertThat(batch.getUnmatchedIds()).isEqualTo(1);
        verify(rpcClient, times(1)).batchCall(any(), anyList());
    }

    @Test
    void executeBatch_nonArrayBody_retriedThenUnavailable() {
        when(rpcClient.batchCall(any(), anyList()))
                .thenReturn(Mono.just("{\"jsonrpc\":\"2.0\",\"id\":null,\"error\":{\"code\":-32600,\"message\":\"batch not supported\"}}"));

        RpcOutcome<RpcBatchResponse> outcome = transport.executeBatch(List.of(RpcRequest.of(0, "eth_call", "a")));

        assertThat(outcome.isUnavailable()).isTrue();
        verify(rpcClient, times(3)).batchCall(any(), anyList());
    }

    @Test
    void executeBatch_duplicateRequestIds_rejected() {
        List<RpcRequest> requests = List.of(RpcRequest.of(0, "eth_call", "a"), RpcRequest.of(0, "eth_call", "b"));

        assertThatThrownBy(() -> transport.executeBatch(requests))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("Duplicate request id");
        verify(rpcClient, never()).batchCall(any(), anyList());
    }

    @Test
    void executeBatch_empty_rejected() {
        assertThatThrownBy(() -> transport.executeBatch(List.of()))
                .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void execute_interruptedWhileWaiting_unavailableAndFlagRestored() {
        RpcTransport interrupting = new RpcTransport(rpcClient, RpcTestSupport.endpoint(3, 10L),
                RpcTestSupport.fastLimiter(), millis -> {
                    throw new InterruptedException("stop");
                }, new ObjectMapper());
        when(rpcClient.call(any(), any())).thenReturn(Mono.error(new RpcException("HTTP 502")));

        try {
            RpcOutcome<RpcResponse> outcome = interrupting.execute(BLOCK_NUMBER);

            assertThat(outcome.isUnavailable()).isTrue();
            assertThat(outcome.reason()).contains("interrupted");
            assertThat(Thread.currentThread().isInterrupted()).isTrue();
        } finally {
            Thread.interrupted();
        }
        verify(rpcClient, times(1)).call(any(), any());
    }
}
