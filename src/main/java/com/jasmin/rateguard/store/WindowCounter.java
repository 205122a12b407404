package com.jasmin.rateguard.store;

import lombok.Value;

import java.time.Instant;

/**
 * One fixed-window counter as held by the store.
 */
@Value
public class WindowCounter {
    long count;
    int maxRequests;
    Instant windowStart;
    Instant windowEnd;
}
