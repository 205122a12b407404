package com.jasmin.rateguard.config;

import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotNull;
import lombok.Data;

import java.time.Duration;

@Data
public class AutoBlockConfig {
    /**
     * Escalate repeated rate limit violations into an entry on the block list.
     */
    private boolean enabled = false;

    /** Violations within {@link #violationWindow} that trigger a block. */
    @Min(1)
    private int violationThreshold = 20;

    @NotNull
    private Duration violationWindow = Duration.ofMinutes(10);

    @Min(1)
    private int blockMinutes = 60;

    private String reason = "Repeated rate limit violations";
}
