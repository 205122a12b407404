package com.jasmin.rateguard.controllers;

import com.jasmin.rateguard.models.RateLimitMetrics;
import com.jasmin.rateguard.services.MetricsAggregator;
import lombok.RequiredArgsConstructor;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

@RequiredArgsConstructor
@RestController
@RequestMapping("/api/rate-limit")
public class RateLimitMetricsController {
    private final MetricsAggregator metricsAggregator;

    @GetMapping("/metrics")
    public RateLimitMetrics getMetrics(@RequestParam(defaultValue = "24") int hours) {
        return metricsAggregator.getMetrics(hours);
    }
}
