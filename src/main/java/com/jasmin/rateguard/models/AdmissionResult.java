package com.jasmin.rateguard.models;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;

@Data
@AllArgsConstructor
@NoArgsConstructor
public class AdmissionResult {
    private boolean allowed;
    private Decision decision;
    private RateLimitStatus status;
    private RateLimitRule rule;

    /** Expiry of the standing block behind an {@link Decision#IP_BLOCKED} rejection; null if permanent. */
    private Instant blockedUntil;

    public enum Decision {
        LIMITER_DISABLED,
        IP_BLOCKED,
        NO_RULE,
        RULE_DISABLED,
        WITHIN_LIMIT,
        RATE_LIMITED,
        FAIL_OPEN
    }

    public static AdmissionResult allow(Decision decision) {
        return new AdmissionResult(true, decision, null, null, null);
    }

    public static AdmissionResult ipBlocked(Instant blockedUntil) {
        return new AdmissionResult(false, Decision.IP_BLOCKED, null, null, blockedUntil);
    }

    public static AdmissionResult counted(RateLimitStatus status, RateLimitRule rule) {
        boolean allowed = !status.isBlocked();
        return new AdmissionResult(allowed, allowed ? Decision.WITHIN_LIMIT : Decision.RATE_LIMITED, status, rule, null);
    }
}
