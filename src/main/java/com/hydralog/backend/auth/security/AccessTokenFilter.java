package com.hydralog.backend.auth.security;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.hydralog.backend.auth.entity.AuthToken;
import com.hydralog.backend.auth.repo.AuthTokenRepo;
import com.hydralog.backend.common.web.RequestIdFilter;
import com.hydralog.backend.logging.dto.LoggingErrorResponse;
import jakarta.servlet.FilterChain;
import jakarta.servlet.ServletException;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import org.slf4j.MDC;
import org.springframework.http.HttpHeaders;
import org.springframework.http.MediaType;
import org.springframework.security.authentication.UsernamePasswordAuthenticationToken;
import org.springframework.security.core.context.SecurityContextHolder;
import org.springframework.security.web.authentication.WebAuthenticationDetailsSource;
import org.springframework.stereotype.Component;
import org.springframework.web.filter.OncePerRequestFilter;

import java.io.IOException;
import java.time.Clock;
import java.time.Instant;
import java.util.Collections;
import java.util.Optional;

@Component
public class AccessTokenFilter extends OncePerRequestFilter {

    public static final String MDC_USER = "uid";

    private final AuthTokenRepo tokens;
    private final Clock clock;
    private final ObjectMapper objectMapper;

    public AccessTokenFilter(AuthTokenRepo tokens, Clock clock, ObjectMapper objectMapper) {
        this.tokens = tokens;
        this.clock = clock;
        this.objectMapper = objectMapper;
    }

    /** Only the treatment API is token-protected. */
    @Override
    protected boolean shouldNotFilter(HttpServletRequest request) {
        return !request.getRequestURI().startsWith("/api/");
    }

    @Override
    protected void doFilterInternal(HttpServletRequest req, HttpServletResponse res, FilterChain chain)
            throws ServletException, IOException {

        String auth = req.getHeader(HttpHeaders.AUTHORIZATION);
        if (auth == null || !auth.startsWith("Bearer ")) {
            // anonymous; the entry point answers 401 for protected paths
            chain.doFilter(req, res);
            return;
        }

        String raw = auth.substring(7).trim();
        Optional<AuthToken> found = tokens.findByToken(raw);
        if (found.isEmpty() || !found.get().isActiveAccessToken(Instant.now(clock))) {
            unauthorized(req, res);
            return;
        }

        // principal carries only the userId, never the entity
        Long uid = found.get().getUserId();
        var authentication = new UsernamePasswordAuthenticationToken(uid, null, Collections.emptyList());
        authentication.setDetails(new WebAuthenticationDetailsSource().buildDetails(req));
        SecurityContextHolder.getContext().setAuthentication(authentication);
        req.setAttribute("userId", uid);

        MDC.put(MDC_USER, String.valueOf(uid));
        try {
            chain.doFilter(req, res);
        } finally {
            MDC.remove(MDC_USER);
        }
    }

    private void unauthorized(HttpServletRequest req, HttpServletResponse res) throws IOException {
        res.setStatus(HttpServletResponse.SC_UNAUTHORIZED);
        res.setContentType(MediaType.APPLICATION_JSON_VALUE);
        objectMapper.writeValue(res.getOutputStream(), new LoggingErrorResponse(
                "UNAUTHORIZED", "Invalid or expired token", RequestIdFilter.getOrCreate(req), "SIGN_IN_AGAIN", null));
    }
}
