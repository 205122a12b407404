package com.jasmin.rateguard.sinks;

import com.jasmin.rateguard.models.ViolationEvent;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

@Slf4j
@Component
public class LoggingViolationSink implements ViolationSink {

    @Override
    public void onViolation(ViolationEvent event) {
        log.info("Blocked request from {} for route {} ({})", event.getIp(), event.getRouteType(), event.getPath());
    }
}
