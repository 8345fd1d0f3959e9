package com.supplyradar.supply;

import com.supplyradar.common.EthHex;
import com.supplyradar.rpc.RpcResponse;

/**
 * Decodes an eth_call response into a raw unsigned value.
 * An absent result, JSON null, "0x" and "0x0" are zero; any other string must be 0x-prefixed hex.
 * Error responses follow {@link CallErrorPolicy}; malformed responses and unparseable results are unavailable.
 */
final class HexQuantityDecoder {

    private HexQuantityDecoder() {
    }

    static QueryValue decode(RpcResponse response, CallErrorPolicy errorPolicy) {
        if (response == null) {
            return QueryValue.UNAVAILABLE;
        }
        if (response.kind() == RpcResponse.Kind.ERROR) {
            return errorPolicy == CallErrorPolicy.ZERO ? QueryValue.zero() : QueryValue.UNAVAILABLE;
        }
        if (!response.isResult()) {
            return QueryValue.UNAVAILABLE;
        }
        if (response.result() == null || response.result().isNull()) {
            return QueryValue.zero();
        }
        String hex = response.resultText();
        if (hex == null) {
            return QueryValue.UNAVAILABLE;
        }
        if ("0x".equals(hex) || "0x0".equals(hex)) {
            return QueryValue.zero();
        }
        return EthHex.parseQuantity(hex)
                .map(QueryValue::of)
                .orElse(QueryValue.UNAVAILABLE);
    }
}
