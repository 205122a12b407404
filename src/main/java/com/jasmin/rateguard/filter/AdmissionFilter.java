package com.jasmin.rateguard.filter;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.jasmin.rateguard.config.FilterConfig;
import com.jasmin.rateguard.config.RateLimitProperties;
import com.jasmin.rateguard.constants.Constants;
import com.jasmin.rateguard.models.AdmissionResult;
import com.jasmin.rateguard.models.RateLimitStatus;
import com.jasmin.rateguard.services.AdmissionService;
import jakarta.servlet.FilterChain;
import jakarta.servlet.ServletException;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.stereotype.Component;
import org.springframework.util.AntPathMatcher;
import org.springframework.util.StringUtils;
import org.springframework.web.filter.OncePerRequestFilter;

import java.io.IOException;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Admits every inbound request through {@link AdmissionService} and turns a rejection into 429.
 */
@Component
@ConditionalOnProperty(prefix = "rate-limiting.filter", name = "enabled", havingValue = "true", matchIfMissing = true)
public class AdmissionFilter extends OncePerRequestFilter {

    private final AdmissionService admissionService;
    private final RateLimitProperties props;
    private final ObjectMapper objectMapper;
    private final Clock clock;
    private final TrustedProxies trustedProxies;
    private final AntPathMatcher matcher = new AntPathMatcher();

    public AdmissionFilter(AdmissionService admissionService, RateLimitProperties props,
                           ObjectMapper objectMapper, Clock clock) {
        this.admissionService = admissionService;
        this.props = props;
        this.objectMapper = objectMapper;
        this.clock = clock;
        this.trustedProxies = new TrustedProxies(props.getFilter().getTrustedProxies());
    }

    @Override
    protected boolean shouldNotFilter(HttpServletRequest request) {
        String path = request.getRequestURI();
        for (String pattern : props.getFilter().getExcludePatterns()) {
            if (matcher.match(pattern, path)) {
                return true;
            }
        }
        return false;
    }

    @Override
    protected void doFilterInternal(HttpServletRequest request,
                                    HttpServletResponse response,
                                    FilterChain filterChain) throws ServletException, IOException {
        String path = request.getRequestURI();
        String ip = resolveClientIp(request);
        String routeType = resolveRouteType(path);

        AdmissionResult result = admissionService.admit(ip, routeType, path);
        RateLimitStatus status = result.getStatus();
        if (status != null) {
            response.setHeader(Constants.HEADER_LIMIT, String.valueOf(status.getMaxRequests()));
            response.setHeader(Constants.HEADER_REMAINING, String.valueOf(status.getRemainingRequests()));
            response.setHeader(Constants.HEADER_RESET, String.valueOf(status.getResetTime().getEpochSecond()));
        }

        if (result.isAllowed()) {
            filterChain.doFilter(request, response);
            return;
        }

        response.setStatus(HttpStatus.TOO_MANY_REQUESTS.value());
        response.setContentType(MediaType.APPLICATION_JSON_VALUE);
        Instant retryAt = status != null ? status.getResetTime() : result.getBlockedUntil();
        if (retryAt != null) {
            long seconds = Math.max(1, Duration.between(clock.instant(), retryAt).toSeconds());
            response.setHeader(HttpHeaders.RETRY_AFTER, String.valueOf(seconds));
        }

        Map<String, Object> body = new LinkedHashMap<>();
        body.put("success", false);
        body.put("error", "Too Many Requests");
        body.put("message", result.getDecision() == AdmissionResult.Decision.IP_BLOCKED
                ? "Client address is blocked"
                : "Rate limit exceeded");
        objectMapper.writeValue(response.getOutputStream(), body);
    }

    private String resolveClientIp(HttpServletRequest request) {
        String remoteAddr = request.getRemoteAddr();
        if (!trustsForwardedHeaders(remoteAddr)) {
            return remoteAddr;
        }
        for (String header : props.getFilter().getClientIpHeaders()) {
            String value = request.getHeader(header);
            if (StringUtils.hasText(value)) {
                String first = value.split(",")[0].trim();
                if (!first.isEmpty()) {
                    return first;
                }
            }
        }
        return remoteAddr;
    }

    private boolean trustsForwardedHeaders(String remoteAddr) {
        FilterConfig filter = props.getFilter();
        return filter.isTrustForwardedHeaders()
                && (trustedProxies.isEmpty() || trustedProxies.contains(remoteAddr));
    }

    /** Null when no mapping matches, leaving the rule to be resolved from the path alone. */
    private String resolveRouteType(String path) {
        for (FilterConfig.RouteMapping route : props.getFilter().getRoutes()) {
            if (route.getPattern() != null && matcher.match(route.getPattern(), path)) {
                return route.getRouteType();
            }
        }
        return null;
    }
}
