package com.jasmin.rateguard.models;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@AllArgsConstructor
@NoArgsConstructor
public class BlockRequest {
    private String ip;
    private Integer durationMinutes;
    private String reason;
    private boolean permanent;
}
