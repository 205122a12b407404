package com.jasmin.rateguard.models;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@AllArgsConstructor
@NoArgsConstructor
public class StatusResponse {
    private String ip;
    private String routeType;
    private boolean ipBlocked;
    private BlockedIP block;
    private RateLimitStatus status;
}
