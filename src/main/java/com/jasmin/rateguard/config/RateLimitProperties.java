package com.jasmin.rateguard.config;

import com.jasmin.rateguard.constants.Constants;
import com.jasmin.rateguard.models.RateLimitRule;
import jakarta.validation.Valid;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;

@Data
@Validated
@ConfigurationProperties(prefix = "rate-limiting")
public class RateLimitProperties {

    /** Master switch. When off every request is admitted. */
    private boolean enabled = true;

    /** Backing of the counter store and rule source. */
    @NotNull
    private StoreType store = StoreType.REDIS;

    /** Route type of the fallback rule used when nothing more specific matches. */
    @NotBlank
    private String defaultRouteType = Constants.DEFAULT_ROUTE_TYPE;

    @NotNull
    private WindowAlignment windowAlignment = WindowAlignment.FORWARD;

    @NotNull
    private Duration ruleRefreshInterval = Duration.ofMinutes(5);

    @NotNull
    private Duration blockSweepInterval = Duration.ofMinutes(1);

    @Min(1)
    private int defaultBlockMinutes = 60;

    /* ------------------------- Metrics ------------------------- */

    @NotNull
    private Duration metricsCacheTtl = Duration.ofMinutes(30);

    /** Hourly metric buckets older than this are left to expire. */
    @Min(1)
    private int metricsRetentionHours = 168;

    @Min(1)
    private int topViolators = 10;

    /** Rules written to an empty rule source on start. */
    @NotNull
    private List<RateLimitRule> seedRules = new ArrayList<>();

    @Valid
    private AutoBlockConfig autoBlock = new AutoBlockConfig();

    @Valid
    private FilterConfig filter = new FilterConfig();

    public Duration metricsRetention() {
        return Duration.ofHours(metricsRetentionHours);
    }

    public enum StoreType {
        REDIS,
        MEMORY
    }

    public enum WindowAlignment {
        /** Window opens at the first request and runs forward. */
        FORWARD,
        /** Window spans one window length either side of the first request. */
        SYMMETRIC
    }
}
