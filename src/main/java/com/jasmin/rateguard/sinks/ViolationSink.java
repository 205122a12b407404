package com.jasmin.rateguard.sinks;

import com.jasmin.rateguard.models.ViolationEvent;

/**
 * Receives every rejected request that exceeded its rule's budget.
 */
public interface ViolationSink {
    void onViolation(ViolationEvent event);
}
