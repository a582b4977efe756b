package me.golemcore.steward.adapter.inbound.web;

import lombok.extern.slf4j.Slf4j;
import me.golemcore.steward.adapter.inbound.web.dto.ApiErrorResponse;
import me.golemcore.steward.domain.model.StewardErrorKind;
import me.golemcore.steward.domain.model.StewardException;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.ControllerAdvice;
import org.springframework.web.bind.annotation.ExceptionHandler;
import reactor.core.publisher.Mono;

import java.util.concurrent.CompletionException;

/**
 * Centralized exception handler for steward controllers. Maps
 * {@link StewardErrorKind} to HTTP statuses.
 */
@ControllerAdvice(basePackages = "me.golemcore.steward.adapter.inbound.web.controller")
@Slf4j
public class GlobalExceptionHandler {

    @ExceptionHandler(StewardException.class)
    public Mono<ResponseEntity<ApiErrorResponse>> handleSteward(StewardException ex) {
        HttpStatus status = statusOf(ex.getKind());
        if (ex.getKind() == StewardErrorKind.SECURITY) {
            log.warn("[API] Security rejection: {}", ex.getMessage());
        } else {
            log.warn("[API] {} {}: {}", status.value(), ex.getKind(), ex.getMessage());
        }
        return respond(status, ex.getKind().name(), ex.getMessage());
    }

    @ExceptionHandler(CompletionException.class)
    public Mono<ResponseEntity<ApiErrorResponse>> handleCompletion(CompletionException ex) {
        if (ex.getCause() instanceof StewardException steward) {
            return handleSteward(steward);
        }
        if (ex.getCause() instanceof IllegalStateException state) {
            return handleIllegalState(state);
        }
        log.error("[API] Internal server error", ex);
        return respond(HttpStatus.INTERNAL_SERVER_ERROR, null, "Internal server error");
    }

    @ExceptionHandler(IllegalArgumentException.class)
    public Mono<ResponseEntity<ApiErrorResponse>> handleIllegalArgument(IllegalArgumentException ex) {
        log.warn("[API] Bad request: {}", ex.getMessage());
        return respond(HttpStatus.BAD_REQUEST, StewardErrorKind.VALIDATION.name(), ex.getMessage());
    }

    @ExceptionHandler(IllegalStateException.class)
    public Mono<ResponseEntity<ApiErrorResponse>> handleIllegalState(IllegalStateException ex) {
        log.warn("[API] Conflict: {}", ex.getMessage());
        return respond(HttpStatus.CONFLICT, StewardErrorKind.CONFLICT.name(), ex.getMessage());
    }

    @ExceptionHandler(Exception.class)
    public Mono<ResponseEntity<ApiErrorResponse>> handleGeneric(Exception ex) {
        log.error("[API] Internal server error", ex);
        return respond(HttpStatus.INTERNAL_SERVER_ERROR, null, "Internal server error");
    }

    static HttpStatus statusOf(StewardErrorKind kind) {
        return switch (kind) {
        case UNRESOLVABLE -> HttpStatus.NOT_FOUND;
        case CONFLICT -> HttpStatus.CONFLICT;
        case GATE_VIOLATION -> HttpStatus.UNPROCESSABLE_ENTITY;
        case TRANSIENT -> HttpStatus.SERVICE_UNAVAILABLE;
        case SECURITY -> HttpStatus.FORBIDDEN;
        case VALIDATION -> HttpStatus.BAD_REQUEST;
        };
    }

    private Mono<ResponseEntity<ApiErrorResponse>> respond(HttpStatus status, String kind, String message) {
        ApiErrorResponse body = ApiErrorResponse.builder()
                .status(status.value())
                .kind(kind)
                .message(message)
                .build();
        return Mono.just(ResponseEntity.status(status).body(body));
    }
}
