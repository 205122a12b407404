package com.jasmin.rateguard.models;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;

@Data
@Builder
@AllArgsConstructor
@NoArgsConstructor
@JsonIgnoreProperties(ignoreUnknown = true)
public class RateLimitStatus {
    private String clientAddress;
    private String routeType;
    private long currentRequests;
    private int maxRequests;
    private Instant windowStart;
    private Instant windowEnd;

    /** The request that crosses the budget is itself counted and rejected. */
    public boolean isBlocked() {
        return currentRequests > maxRequests;
    }

    public long getRemainingRequests() {
        return Math.max(0L, maxRequests - currentRequests);
    }

    public Instant getResetTime() {
        return windowEnd;
    }
}
