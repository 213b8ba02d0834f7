package com.hydralog.backend.auth.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.hydralog.backend.auth.security.AccessTokenFilter;
import com.hydralog.backend.common.web.RequestIdFilter;
import com.hydralog.backend.logging.dto.LoggingErrorResponse;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.http.MediaType;
import org.springframework.security.config.Customizer;
import org.springframework.security.config.annotation.web.builders.HttpSecurity;
import org.springframework.security.config.http.SessionCreationPolicy;
import org.springframework.security.web.SecurityFilterChain;
import org.springframework.security.web.authentication.UsernamePasswordAuthenticationFilter;

import java.io.IOException;

@Configuration
public class SecurityConfig {

    private final AccessTokenFilter accessTokenFilter;
    private final ObjectMapper objectMapper;

    public SecurityConfig(AccessTokenFilter accessTokenFilter, ObjectMapper objectMapper) {
        this.accessTokenFilter = accessTokenFilter;
        this.objectMapper = objectMapper;
    }

    @Bean
    public SecurityFilterChain securityFilterChain(HttpSecurity http) throws Exception {
        http
                .csrf(csrf -> csrf.disable())
                .cors(Customizer.withDefaults())
                .httpBasic(b -> b.disable())
                .formLogin(f -> f.disable())
                .logout(l -> l.disable())
                .sessionManagement(sm -> sm.sessionCreationPolicy(SessionCreationPolicy.STATELESS))
                .authorizeHttpRequests(reg -> reg
                        .requestMatchers("/actuator/health/**", "/actuator/info").permitAll()
                        .requestMatchers("/api/v1/treatments/**").authenticated()
                        .anyRequest().denyAll()
                )
                .addFilterBefore(accessTokenFilter, UsernamePasswordAuthenticationFilter.class)
                .exceptionHandling(ex -> ex
                        .authenticationEntryPoint((req, res, e) ->
                                writeError(req, res, HttpServletResponse.SC_UNAUTHORIZED,
                                        "UNAUTHORIZED", "Bearer token required"))
                        .accessDeniedHandler((req, res, e) ->
                                writeError(req, res, HttpServletResponse.SC_FORBIDDEN,
                                        "FORBIDDEN", "Access denied"))
                );

        return http.build();
    }

    private void writeError(HttpServletRequest req, HttpServletResponse res, int status,
                            String code, String message) throws IOException {
        res.setStatus(status);
        res.setContentType(MediaType.APPLICATION_JSON_VALUE);
        LoggingErrorResponse body = new LoggingErrorResponse(
                code, message, RequestIdFilter.getOrCreate(req), "SIGN_IN_AGAIN", null);
        objectMapper.writeValue(res.getOutputStream(), body);
    }
}
