package com.example.admission.filter;

import com.example.admission.config.AdmissionProperties;
import com.example.admission.controller.dto.ErrorResponse;
import com.example.admission.exception.UnconfiguredException;
import com.example.admission.model.AdmissionResult;
import com.example.admission.service.AdmissionController;
import com.example.admission.service.AdmissionRegistry;
import com.fasterxml.jackson.databind.ObjectMapper;
import jakarta.servlet.FilterChain;
import jakarta.servlet.ServletException;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.stereotype.Component;
import org.springframework.web.filter.OncePerRequestFilter;

import java.io.IOException;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;

/**
 * Servlet filter that runs every non-administrative request through admission control.
 *
 * All decisions are made by the {@link AdmissionController}s of the request's limit group,
 * its own limit first and then its tiers; the first denial ends the walk. This class only picks
 * the group and client key and maps the result to HTTP (429 or 503). The budget headers
 * describe the tightest limit seen.
 */
@Component
public class AdmissionFilter extends OncePerRequestFilter {

    private static final Logger log = LoggerFactory.getLogger(AdmissionFilter.class);

    static final String LIMIT_HEADER = "X-RateLimit-Limit";
    static final String REMAINING_HEADER = "X-RateLimit-Remaining";
    static final String TOO_MANY_REQUESTS = "Too many requests";

    private final AdmissionRegistry registry;
    private final AdmissionProperties properties;
    private final ObjectMapper objectMapper;
    private final Clock clock;

    public AdmissionFilter(
            AdmissionRegistry registry,
            AdmissionProperties properties,
            ObjectMapper objectMapper,
            Clock clock
    ) {
        this.registry = registry;
        this.properties = properties;
        this.objectMapper = objectMapper;
        this.clock = clock;
    }

    @Override
    protected boolean shouldNotFilter(HttpServletRequest request) {
        String path = request.getRequestURI();
        return path.equals("/rate_limit")
                || path.startsWith("/rate_limit/")
                || path.equals("/health-check");
    }

    @Override
    protected void doFilterInternal(
            HttpServletRequest request,
            HttpServletResponse response,
            FilterChain filterChain
    ) throws ServletException, IOException {

        String group = resolveGroup(request.getRequestURI());
        String clientKey = extractClientKey(request);

        AdmissionResult result = null;
        AdmissionController deciding = null;
        try {
            Instant now = clock.instant();
            for (AdmissionController controller : registry.chainOrDefault(group)) {
                AdmissionResult tierResult = controller.evaluate(clientKey, now);
                if (result == null || !tierResult.isAllowed() || tierResult.getRemaining() < result.getRemaining()) {
                    result = tierResult;
                    deciding = controller;
                }
                if (!tierResult.isAllowed()) {
                    break;
                }
            }
        } catch (UnconfiguredException ex) {
            log.error("Rejecting request from {} on {}: {}", clientKey, request.getRequestURI(), ex.getMessage());
            writeError(response, HttpStatus.SERVICE_UNAVAILABLE, "Rate limiting is not configured");
            return;
        }

        response.setHeader(LIMIT_HEADER, Integer.toString(result.getLimit()));
        response.setHeader(REMAINING_HEADER, Integer.toString(result.getRemaining()));

        if (result.isAllowed()) {
            filterChain.doFilter(request, response);
            return;
        }

        log.debug("Client {} denied on group {}", clientKey, deciding.getGroup());
        response.setHeader(HttpHeaders.RETRY_AFTER, Long.toString(retryAfterSeconds(result)));
        writeError(response, HttpStatus.TOO_MANY_REQUESTS, TOO_MANY_REQUESTS);
    }

    private void writeError(HttpServletResponse response, HttpStatus status, String message) throws IOException {
        response.setStatus(status.value());
        response.setContentType(MediaType.APPLICATION_JSON_VALUE);
        objectMapper.writeValue(response.getWriter(), new ErrorResponse(message));
    }

    String resolveGroup(String path) {
        if (path != null && (path.equals("/api/resource") || path.startsWith("/api/resource/"))) {
            return AdmissionRegistry.RESOURCE_GROUP;
        }
        return AdmissionRegistry.DEFAULT_GROUP;
    }

    String extractClientKey(HttpServletRequest request) {
        if (properties.isTrustForwardedHeaders()) {
            String realIp = request.getHeader("X-Real-IP");
            if (realIp != null && !realIp.isBlank()) {
                return realIp.trim();
            }
            String forwarded = request.getHeader("X-Forwarded-For");
            if (forwarded != null && !forwarded.isBlank()) {
                return forwarded.split(",")[0].trim();
            }
        }
        return request.getRemoteAddr();
    }

    // Whole seconds, rounded up, never below one.
    private static long retryAfterSeconds(AdmissionResult result) {
        Duration retryAfter = result.getRetryAfter();
        long seconds = retryAfter.getSeconds();
        if (retryAfter.getNano() > 0 && seconds < Long.MAX_VALUE) {
            seconds++;
        }
        return Math.max(1L, seconds);
    }
}
