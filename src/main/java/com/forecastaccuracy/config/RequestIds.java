package com.forecastaccuracy.config;

import jakarta.servlet.http.HttpServletRequest;

import java.util.UUID;

/**
 * Correlation id of the current request. {@link ApiGuardFilter} stores it as a request
 * attribute; callers outside the filter fall back to the header or a fresh id.
 */
public final class RequestIds {

    public static final String HEADER = "X-Request-ID";
    public static final String ATTRIBUTE = RequestIds.class.getName() + ".requestId";
    public static final String MDC_KEY = "requestId";

    private RequestIds() {
    }

    public static String resolve(HttpServletRequest request) {
        Object stored = request.getAttribute(ATTRIBUTE);
        if (stored instanceof String id) {
            return id;
        }
        String header = request.getHeader(HEADER);
        return (header != null && !header.isBlank()) ? header : UUID.randomUUID().toString();
    }
}
