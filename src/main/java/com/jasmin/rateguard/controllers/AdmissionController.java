package com.jasmin.rateguard.controllers;

import com.jasmin.rateguard.constants.Constants;
import com.jasmin.rateguard.models.AdmissionResult;
import com.jasmin.rateguard.models.CheckRequest;
import com.jasmin.rateguard.models.StatusResponse;
import com.jasmin.rateguard.services.AdmissionService;
import com.jasmin.rateguard.services.BlockListService;
import com.jasmin.rateguard.services.WindowTracker;
import lombok.RequiredArgsConstructor;
import org.springframework.util.StringUtils;
import org.springframework.web.bind.annotation.*;

@RestController
@RequestMapping("/api/rate-limit")
@RequiredArgsConstructor
public class AdmissionController {

    private final AdmissionService admissionService;
    private final WindowTracker windowTracker;
    private final BlockListService blockList;

    @PostMapping("/check")
    public AdmissionResult check(@RequestBody CheckRequest request) {
        if (!StringUtils.hasText(request.getIp())) {
            throw new IllegalArgumentException("Missing required field: ip");
        }
        String routeType = StringUtils.hasText(request.getRouteType()) ? request.getRouteType() : null;
        String path = StringUtils.hasText(request.getPath()) ? request.getPath() : "/";
        return admissionService.admit(request.getIp(), routeType, path);
    }

    /** Current window and block state of an address; does not count a request. */
    @GetMapping("/status/{ip}")
    public StatusResponse status(@PathVariable String ip,
                                 @RequestParam(defaultValue = Constants.DEFAULT_ROUTE_TYPE) String routeType) {
        return new StatusResponse(
                ip,
                routeType,
                blockList.isBlocked(ip),
                blockList.getBlock(ip).orElse(null),
                windowTracker.getStatus(ip, routeType).orElse(null)
        );
    }
}
