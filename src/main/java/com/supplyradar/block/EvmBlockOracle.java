package com.supplyradar.block;

import com.fasterxml.jackson.databind.JsonNode;
import com.supplyradar.common.EthHex;
import com.supplyradar.rpc.RpcOutcome;
import com.supplyradar.rpc.RpcRequest;
import com.supplyradar.rpc.RpcResponse;
import com.supplyradar.rpc.RpcTransport;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.time.Instant;

/**
 * Head number via eth_blockNumber, block timestamp via eth_getBlockByNumber (header only).
 * JSON-RPC errors, null blocks and malformed hex are reported as unavailable.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class EvmBlockOracle implements BlockOracle {

    private static final int REQUEST_ID = 1;

    private final RpcTransport transport;

    @Override
    public RpcOutcome<Long> latestBlockNumber() {
        return transport.execute(RpcRequest.of(REQUEST_ID, "eth_blockNumber"))
                .flatMap(response -> {
                    String hex = successText(response, "eth_blockNumber");
                    return EthHex.parseLong(hex)
                            .map(RpcOutcome::available)
                            .orElseGet(() -> RpcOutcome.unavailable("eth_blockNumber invalid result: " + hex));
                });
    }

    @Override
    public RpcOutcome<Instant> blockTimestamp(long blockNumber) {
        String blockHex = EthHex.toQuantity(blockNumber);
        return transport.execute(RpcRequest.of(REQUEST_ID, "eth_getBlockByNumber", blockHex, false))
                .flatMap(response -> {
                    if (!response.isResult()) {
                        log.debug("eth_getBlockByNumber {} returned {}", blockHex, response.describe());
                        return RpcOutcome.unavailable("eth_getBlockByNumber " + response.describe());
                    }
                    JsonNode block = response.result();
                    if (block == null || !block.isObject()) {
                        return RpcOutcome.unavailable("eth_getBlockByNumber no block " + blockNumber);
                    }
                    String timestampHex = block.path("timestamp").asText(null);
                    return EthHex.parseLong(timestampHex)
                            .map(Instant::ofEpochSecond)
                            .map(RpcOutcome::available)
                            .orElseGet(() -> RpcOutcome.unavailable(
                                    "eth_getBlockByNumber invalid timestamp: " + timestampHex));
                });
    }

    private static String successText(RpcResponse response, String method) {
        if (!response.isResult()) {
            log.debug("{} returned {}", method, response.describe());
            return null;
        }
        return response.resultText();
    }
}
