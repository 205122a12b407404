package com.jasmin.rateguard.models;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

@Data
@Builder(toBuilder = true)
@AllArgsConstructor
@NoArgsConstructor
@JsonIgnoreProperties(ignoreUnknown = true)
public class RateLimitRule {
    private String id;

    /** Unique key of the rule inside the active rule set. */
    private String routeType;

    private int maxRequests;
    private int windowMinutes;

    @Builder.Default
    private boolean enabled = true;

    /** Higher wins when several strict rules match the same path. */
    private int priority;

    /** Path prefixes this rule never applies to. */
    @Builder.Default
    private List<String> exemptPaths = new ArrayList<>();

    /** Path prefixes that force this rule regardless of the requested route type. */
    @Builder.Default
    private List<String> strictPaths = new ArrayList<>();

    private Instant createdAt;
    private Instant updatedAt;
}
