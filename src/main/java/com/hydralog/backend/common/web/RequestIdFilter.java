package com.hydralog.backend.common.web;

import jakarta.servlet.FilterChain;
import jakarta.servlet.ServletException;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import org.slf4j.MDC;
import org.springframework.core.Ordered;
import org.springframework.core.annotation.Order;
import org.springframework.stereotype.Component;
import org.springframework.web.filter.OncePerRequestFilter;

import java.io.IOException;
import java.util.UUID;
import java.util.regex.Pattern;

/**
 * Correlation id for every treatment request. A client-sent {@code X-Request-Id} is reused when it looks
 * sane, so an offline replay of a queued write can be matched to its first attempt in the logs.
 */
@Component
@Order(Ordered.HIGHEST_PRECEDENCE)
public class RequestIdFilter extends OncePerRequestFilter {

    public static final String HEADER = "X-Request-Id";
    public static final String ATTR = "requestId";
    public static final String MDC_KEY = "rid";

    private static final Pattern SAFE_ID = Pattern.compile("[A-Za-z0-9._:-]{1,64}");

    @Override
    protected void doFilterInternal(HttpServletRequest req, HttpServletResponse res, FilterChain chain)
            throws ServletException, IOException {

        String rid = accept(req.getHeader(HEADER));

        req.setAttribute(ATTR, rid);
        res.setHeader(HEADER, rid);
        MDC.put(MDC_KEY, rid);
        try {
            chain.doFilter(req, res);
        } finally {
            MDC.remove(MDC_KEY);
        }
    }

    static String accept(String header) {
        if (header == null) return UUID.randomUUID().toString();
        String trimmed = header.trim();
        return SAFE_ID.matcher(trimmed).matches() ? trimmed : UUID.randomUUID().toString();
    }

    public static String getOrCreate(HttpServletRequest req) {
        Object v = req.getAttribute(ATTR);
        return (v == null) ? UUID.randomUUID().toString() : String.valueOf(v);
    }
}
