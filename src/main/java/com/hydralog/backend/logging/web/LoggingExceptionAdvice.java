package com.hydralog.backend.logging.web;

import com.hydralog.backend.common.web.RequestIdFilter;
import com.hydralog.backend.logging.controller.OfflineQueueController;
import com.hydralog.backend.logging.controller.TreatmentContextController;
import com.hydralog.backend.logging.controller.TreatmentLoggingController;
import com.hydralog.backend.logging.controller.TreatmentSummaryController;
import com.hydralog.backend.logging.dto.LoggingErrorResponse;
import com.hydralog.backend.logging.error.ErrorKind;
import com.hydralog.backend.logging.error.LoggingException;
import jakarta.servlet.http.HttpServletRequest;
import lombok.extern.slf4j.Slf4j;
import org.springframework.core.Ordered;
import org.springframework.core.annotation.Order;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.web.bind.MethodArgumentNotValidException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;

import java.util.List;
import java.util.Map;

@Slf4j
@RestControllerAdvice(assignableTypes = {
        TreatmentLoggingController.class,
        TreatmentSummaryController.class,
        OfflineQueueController.class,
        TreatmentContextController.class
})
@Order(Ordered.HIGHEST_PRECEDENCE)
public class LoggingExceptionAdvice {

    @ExceptionHandler(LoggingException.class)
    public ResponseEntity<LoggingErrorResponse> handleLogging(LoggingException e, HttpServletRequest req) {
        HttpStatus status = statusOf(e.kind());
        if (status.is5xxServerError()) {
            log.warn("logging failure kind={} rid={}: {}", e.kind(), RequestIdFilter.getOrCreate(req), e.getMessage());
        }
        return ResponseEntity.status(status)
                .body(new LoggingErrorResponse(e.kind().name(), e.getMessage(), RequestIdFilter.getOrCreate(req),
                        clientActionOf(e.kind()), e.context()));
    }

    @ExceptionHandler(MethodArgumentNotValidException.class)
    public ResponseEntity<LoggingErrorResponse> handleInvalidBody(MethodArgumentNotValidException e,
                                                                  HttpServletRequest req) {
        List<String> errors = e.getBindingResult().getFieldErrors().stream()
                .map(fe -> fe.getField() + ": " + fe.getDefaultMessage())
                .toList();
        return badRequest("Request body is invalid", Map.of("errors", errors), req);
    }

    @ExceptionHandler(HttpMessageNotReadableException.class)
    public ResponseEntity<LoggingErrorResponse> handleUnreadable(HttpMessageNotReadableException e,
                                                                 HttpServletRequest req) {
        return badRequest("Request body could not be read", null, req);
    }

    @ExceptionHandler(IllegalArgumentException.class)
    public ResponseEntity<LoggingErrorResponse> handleIllegalArg(IllegalArgumentException e, HttpServletRequest req) {
        return badRequest(e.getMessage() == null ? "BAD_REQUEST" : e.getMessage(), null, req);
    }

    static HttpStatus statusOf(ErrorKind kind) {
        return switch (kind) {
            case VALIDATION_FAILURE -> HttpStatus.BAD_REQUEST;
            case SESSION_NOT_FOUND -> HttpStatus.NOT_FOUND;
            case DUPLICATE_CONFLICT -> HttpStatus.CONFLICT;
            case NO_SCHEDULES -> HttpStatus.UNPROCESSABLE_ENTITY;
            case RECONCILIATION_EMPTY -> HttpStatus.OK;
            case QUEUE_WARNING -> HttpStatus.ACCEPTED;
            case ATOMIC_WRITE_FAILURE, QUEUE_FULL, SYNC_FAILURE -> HttpStatus.SERVICE_UNAVAILABLE;
        };
    }

    static String clientActionOf(ErrorKind kind) {
        return switch (kind) {
            case VALIDATION_FAILURE -> "FIX_INPUT";
            case SESSION_NOT_FOUND -> "REFRESH";
            case DUPLICATE_CONFLICT -> "CONFIRM_OR_CANCEL";
            case NO_SCHEDULES -> "SET_UP_SCHEDULES";
            case RECONCILIATION_EMPTY -> "SHOW_ALL_CAUGHT_UP";
            case QUEUE_WARNING -> "SHOW_QUEUE_WARNING";
            case ATOMIC_WRITE_FAILURE -> "RETRY_LATER";
            case QUEUE_FULL -> "SYNC_BEFORE_LOGGING";
            case SYNC_FAILURE -> "TAP_TO_RETRY";
        };
    }

    private static ResponseEntity<LoggingErrorResponse> badRequest(String message, Map<String, Object> context,
                                                                   HttpServletRequest req) {
        return ResponseEntity.badRequest()
                .body(new LoggingErrorResponse(ErrorKind.VALIDATION_FAILURE.name(), message,
                        RequestIdFilter.getOrCreate(req), clientActionOf(ErrorKind.VALIDATION_FAILURE), context));
    }
}
