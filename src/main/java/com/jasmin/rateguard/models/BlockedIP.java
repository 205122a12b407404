package com.jasmin.rateguard.models;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.util.HashMap;
import java.util.Map;

@Data
@Builder(toBuilder = true)
@AllArgsConstructor
@NoArgsConstructor
@JsonIgnoreProperties(ignoreUnknown = true)
public class BlockedIP {
    private String id;
    private String ipAddress;
    private String reason;
    private Instant blockedAt;

    /** Ignored for permanent blocks. */
    private Instant expiresAt;

    private boolean permanent;
    private int attempts;

    @Builder.Default
    private Map<String, String> metadata = new HashMap<>();

    public boolean isActiveAt(Instant now) {
        return permanent || (expiresAt != null && expiresAt.isAfter(now));
    }
}
