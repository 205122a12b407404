package com.jasmin.rateguard.models;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;

@Data
@AllArgsConstructor
@NoArgsConstructor
public class ViolationEvent {
    private String ip;
    private String routeType;
    private String path;
    private Instant timestamp;
}
