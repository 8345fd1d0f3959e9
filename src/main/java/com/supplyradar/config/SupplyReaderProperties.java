package com.supplyradar.config;

import com.supplyradar.supply.CallErrorPolicy;
import com.supplyradar.supply.SupplyQuery;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotNull;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

import java.util.ArrayList;
import java.util.List;

/**
 * Batch read retry budget and the token table read at every resolved block.
 */
@ConfigurationProperties(prefix = "supplyradar.reader")
@Validated
@NoArgsConstructor
@Getter
@Setter
public class SupplyReaderProperties {

    /** Whole-batch attempts when some values stay unavailable. Default 3. */
    @Min(1)
    private int maxAttempts = 3;

    /** Fixed delay between whole-batch attempts. Default 1000. */
    @Min(0)
    private long retryDelayMs = 1_000L;

    /** How an eth_call error object is read: ZERO (default) or UNAVAILABLE. */
    @NotNull
    private CallErrorPolicy callErrorPolicy = CallErrorPolicy.ZERO;

    private List<TokenEntry> tokens = new ArrayList<>();

    public void setTokens(List<TokenEntry> tokens) {
        this.tokens = tokens != null ? tokens : new ArrayList<>();
    }

    public List<SupplyQuery> toQueries() {
        return tokens.stream()
                .map(t -> new SupplyQuery(t.getName(), t.getContract(), t.getCallData(), t.getDecimals()))
                .toList();
    }

    /**
     * One configured token. callData defaults to totalSupply().
     */
    @NoArgsConstructor
    @Getter
    @Setter
    public static class TokenEntry {

        private String name;
        private String contract;
        private int decimals;
        private String callData = SupplyQuery.TOTAL_SUPPLY_SELECTOR;
    }
}
