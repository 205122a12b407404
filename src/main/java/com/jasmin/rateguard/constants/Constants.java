package com.jasmin.rateguard.constants;

public class Constants {
    public static final String DEFAULT_ROUTE_TYPE = "default";

    public static final String MANUAL_BLOCK_REASON = "Manual block";
    public static final String VIOLATION_BLOCK_REASON = "Rate limit violation";
    public static final String AUTO_BLOCK_SOURCE = "auto";
    public static final String MANUAL_BLOCK_SOURCE = "manual";

    public static final String HEADER_LIMIT = "X-RateLimit-Limit";
    public static final String HEADER_REMAINING = "X-RateLimit-Remaining";
    public static final String HEADER_RESET = "X-RateLimit-Reset";
}
