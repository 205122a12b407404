package com.jasmin.rateguard.controllers;

import com.jasmin.rateguard.config.RateLimitProperties;
import com.jasmin.rateguard.constants.Constants;
import com.jasmin.rateguard.models.BlockRequest;
import com.jasmin.rateguard.models.BlockedIP;
import com.jasmin.rateguard.services.BlockListService;
import lombok.RequiredArgsConstructor;
import org.springframework.util.StringUtils;
import org.springframework.web.bind.annotation.*;

import java.util.List;
import java.util.Map;

@RestController
@RequestMapping("/api/rate-limit")
@RequiredArgsConstructor
public class BlockedIpController {

    private final BlockListService blockList;
    private final RateLimitProperties props;

    @PostMapping("/block-ip")
    public BlockedIP blockIp(@RequestBody BlockRequest request) {
        String reason = StringUtils.hasText(request.getReason()) ? request.getReason() : Constants.VIOLATION_BLOCK_REASON;
        if (request.isPermanent()) {
            return blockList.blockPermanently(request.getIp(), reason);
        }
        int minutes = request.getDurationMinutes() != null ? request.getDurationMinutes() : props.getDefaultBlockMinutes();
        return blockList.block(request.getIp(), minutes, reason);
    }

    @PostMapping("/unblock-ip")
    public Map<String, Object> unblockIp(@RequestBody BlockRequest request) {
        if (!StringUtils.hasText(request.getIp())) {
            throw new IllegalArgumentException("Missing required field: ip");
        }
        boolean removed = blockList.unblock(request.getIp());
        return Map.of("ip", request.getIp(), "unblocked", removed);
    }

    @GetMapping("/blocked-ips")
    public List<BlockedIP> getBlockedIps() {
        return blockList.listBlocked();
    }
}
