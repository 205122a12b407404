package com.jasmin.rateguard.models;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@AllArgsConstructor
@NoArgsConstructor
public class CheckRequest {
    private String ip;
    private String routeType;
    private String path;
}
