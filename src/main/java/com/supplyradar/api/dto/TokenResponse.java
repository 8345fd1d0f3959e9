package com.supplyradar.api.dto;

import com.supplyradar.supply.SupplyQuery;

/**
 * GET /api/v1/supply/tokens item.
 */
public record TokenResponse(String name, String contract, int decimals, String callData) {

    public static TokenResponse from(SupplyQuery query) {
        return new TokenResponse(query.name(), query.contractAddress(), query.decimals(), query.callData());
    }
}
