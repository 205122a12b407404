package com.jasmin.rateguard.models;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;

/**
 * Partial rule update. Null fields keep the stored value.
 */
@Data
@Builder
@AllArgsConstructor
@NoArgsConstructor
public class RuleUpdate {
    private Integer maxRequests;
    private Integer windowMinutes;
    private Boolean enabled;
    private Integer priority;
    private List<String> exemptPaths;
    private List<String> strictPaths;
}
