package com.supplyradar.config;

import jakarta.validation.constraints.Min;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

/**
 * Date range limits for supply history collection.
 */
@ConfigurationProperties(prefix = "supplyradar.history")
@Validated
@NoArgsConstructor
@Getter
@Setter
public class HistoryProperties {

    /** Days covered when the caller gives no range (ending today, UTC). */
    @Min(1)
    private int defaultRangeDays = 60;

    /** Largest accepted range, inclusive of both ends. */
    @Min(1)
    private int maxRangeDays = 366;

    /** Drop a date entirely when some values stay unavailable after all batch attempts. False keeps it with null supplies. */
    private boolean skipIncompleteDates = true;
}
