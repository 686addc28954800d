package com.forecastaccuracy.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.forecastaccuracy.dto.ApiError;
import jakarta.servlet.FilterChain;
import jakarta.servlet.ServletException;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.slf4j.MDC;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.stereotype.Component;
import org.springframework.web.filter.OncePerRequestFilter;

import java.io.IOException;
import java.time.Instant;
import java.util.Arrays;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.stream.Collectors;

/**
 * Front door for {@code /api/**}: assigns the request id, then applies the optional
 * API-key check and the per-client fixed-window rate limit.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class ApiGuardFilter extends OncePerRequestFilter {

    private static final int MAX_TRACKED_CLIENTS = 10_000;

    private final ObjectMapper objectMapper;
    private final ConcurrentHashMap<String, MinuteCounter> counters = new ConcurrentHashMap<>();

    @Value("${security.api-key.enabled:false}")
    private boolean apiKeyEnabled;

    @Value("${security.api-key.header:X-API-Key}")
    private String apiKeyHeader;

    @Value("${security.api-key.values:}")
    private String apiKeyValues;

    @Value("${security.rate-limit.enabled:false}")
    private boolean rateLimitEnabled;

    @Value("${security.rate-limit.requests-per-minute:120}")
    private int requestsPerMinute;

    @Override
    protected boolean shouldNotFilter(HttpServletRequest request) {
        return !request.getRequestURI().startsWith("/api/");
    }

    @Override
    protected void doFilterInternal(
            HttpServletRequest request, HttpServletResponse response, FilterChain chain)
            throws ServletException, IOException {

        String requestId = RequestIds.resolve(request);
        request.setAttribute(RequestIds.ATTRIBUTE, requestId);
        response.setHeader(RequestIds.HEADER, requestId);
        MDC.put(RequestIds.MDC_KEY, requestId);
        try {
            String apiKey = request.getHeader(apiKeyHeader);
            if (apiKeyEnabled && !acceptedKeys().contains(apiKey)) {
                reject(response, request, HttpStatus.UNAUTHORIZED, "UNAUTHORIZED", "Missing or invalid API key", requestId);
                return;
            }
            if (rateLimitEnabled && !tryAcquire(clientKey(request, apiKey))) {
                reject(response, request, HttpStatus.TOO_MANY_REQUESTS, "RATE_LIMITED", "Rate limit exceeded", requestId);
                return;
            }
            chain.doFilter(request, response);
        } finally {
            MDC.remove(RequestIds.MDC_KEY);
        }
    }

    private Set<String> acceptedKeys() {
        return Arrays.stream(apiKeyValues.split(","))
            .map(String::trim)
            .filter(v -> !v.isBlank())
            .collect(Collectors.toSet());
    }

    private static String clientKey(HttpServletRequest request, String apiKey) {
        if (apiKey != null && !apiKey.isBlank()) {
            return "key:" + apiKey;
        }
        String forwardedFor = request.getHeader("X-Forwarded-For");
        if (forwardedFor != null && !forwardedFor.isBlank()) {
            return "ip:" + forwardedFor.split(",")[0].trim();
        }
        return "ip:" + request.getRemoteAddr();
    }

    private boolean tryAcquire(String clientKey) {
        long minute = Instant.now().getEpochSecond() / 60;
        MinuteCounter counter = counters.compute(clientKey, (k, existing) ->
            existing == null || existing.minute != minute ? new MinuteCounter(minute) : existing);
        if (counters.size() > MAX_TRACKED_CLIENTS) {
            counters.entrySet().removeIf(e -> e.getValue().minute < minute - 1);
        }
        return counter.hits.incrementAndGet() <= requestsPerMinute;
    }

    private void reject(HttpServletResponse response, HttpServletRequest request, HttpStatus status,
                        String code, String message, String requestId) throws IOException {
        response.setStatus(status.value());
        response.setContentType(MediaType.APPLICATION_JSON_VALUE);
        objectMapper.writeValue(response.getWriter(), ApiError.builder()
            .status(status.value())
            .error(status.getReasonPhrase())
            .code(code)
            .message(message)
            .path(request.getRequestURI())
            .requestId(requestId)
            .timestamp(Instant.now())
            .build());
        log.warn("Request rejected | status={} | code={} | path={} | requestId={}",
            status.value(), code, request.getRequestURI(), requestId);
    }

    private static final class MinuteCounter {
        private final long minute;
        private final AtomicInteger hits = new AtomicInteger();

        private MinuteCounter(long minute) {
            this.minute = minute;
        }
    }
}
