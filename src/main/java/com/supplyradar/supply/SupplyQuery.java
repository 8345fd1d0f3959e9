package com.supplyradar.supply;

/**
 * One scalar contract read: {@code eth_call} of {@code callData} against {@code contractAddress}.
 * {@code decimals} is carried for scaling at the presentation boundary; raw reads ignore it.
 */
public record SupplyQuery(String name, String contractAddress, String callData, int decimals) {

    /** ERC20 totalSupply() selector: keccak256("totalSupply()") first 4 bytes. */
    public static final String TOTAL_SUPPLY_SELECTOR = "0x18160ddd";

    public SupplyQuery {
        if (name == null || name.isBlank()) {
            throw new IllegalArgumentException("query name is required");
        }
        if (contractAddress == null || contractAddress.isBlank()) {
            throw new IllegalArgumentException("contract address is required for " + name);
        }
        if (decimals < 0) {
            throw new IllegalArgumentException("decimals must not be negative for " + name);
        }
        if (callData == null || callData.isBlank()) {
            callData = TOTAL_SUPPLY_SELECTOR;
        }
    }

    public static SupplyQuery totalSupply(String name, String contractAddress, int decimals) {
        return new SupplyQuery(name, contractAddress, TOTAL_SUPPLY_SELECTOR, decimals);
    }
}
