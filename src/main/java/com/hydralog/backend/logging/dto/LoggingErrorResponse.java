package com.hydralog.backend.logging.dto;

import com.fasterxml.jackson.annotation.JsonInclude;

import java.util.Map;

@JsonInclude(JsonInclude.Include.NON_NULL)
public record LoggingErrorResponse(
        String errorCode,
        String message,
        String requestId,
        String clientAction,
        Map<String, Object> context
) {
}
