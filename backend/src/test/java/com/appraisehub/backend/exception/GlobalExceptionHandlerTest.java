package com.appraisehub.backend.exception;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.orm.ObjectOptimisticLockingFailureException;
import org.springframework.security.access.AccessDeniedException;
import org.springframework.web.method.annotation.MethodArgumentTypeMismatchException;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;

class GlobalExceptionHandlerTest {

    private final GlobalExceptionHandler handler = new GlobalExceptionHandler(
            Clock.fixed(Instant.parse("2026-03-15T09:00:00Z"), ZoneOffset.UTC));

    @Test
    @DisplayName("each workflow error maps to its status with the message as body")
    void statusMapping() {
        assertThat(handler.handleNotFound(NotFoundException.of("Evaluation", 9L)).getStatusCode())
                .isEqualTo(HttpStatus.NOT_FOUND);
        assertThat(handler.handleForbidden(new ForbiddenException("no")).getStatusCode())
                .isEqualTo(HttpStatus.FORBIDDEN);
        assertThat(handler.handleValidation(new ValidationException("bad")).getStatusCode())
                .isEqualTo(HttpStatus.BAD_REQUEST);
        assertThat(handler.handleConflict(new ConflictException("again")).getStatusCode())
                .isEqualTo(HttpStatus.CONFLICT);
        assertThat(handler.handleAccessDenied(new AccessDeniedException("denied")).getStatusCode())
                .isEqualTo(HttpStatus.FORBIDDEN);
    }

    @Test
    @DisplayName("not found carries the entity and id")
    void notFoundBody() {
        ResponseEntity<Map<String, Object>> response = handler.handleNotFound(NotFoundException.of("Evaluation", 9L));

        assertThat(response.getBody()).containsEntry("error", "Evaluation not found: 9");
        assertThat(response.getBody()).containsEntry("timestamp", "2026-03-15T09:00:00Z");
    }

    @Test
    @DisplayName("a non-numeric path id is a bad request naming the parameter")
    void typeMismatch() {
        MethodArgumentTypeMismatchException ex = new MethodArgumentTypeMismatchException(
                "abc", Long.class, "id", null, new NumberFormatException("For input string: \"abc\""));

        ResponseEntity<Map<String, Object>> response = handler.handleTypeMismatch(ex);

        assertThat(response.getStatusCode()).isEqualTo(HttpStatus.BAD_REQUEST);
        assertThat(response.getBody()).containsEntry("error", "Invalid value 'abc' for id");
    }

    @Test
    @DisplayName("a stale version is reported as a conflict")
    void staleWrite() {
        ResponseEntity<Map<String, Object>> response = handler.handleStaleWrite(
                new ObjectOptimisticLockingFailureException("Evaluation", 10L));

        assertThat(response.getStatusCode()).isEqualTo(HttpStatus.CONFLICT);
    }

    @Test
    @DisplayName("unexpected errors do not leak their message")
    void unhandled() {
        ResponseEntity<Map<String, Object>> response = handler.handleUnhandled(new IllegalStateException("db password"));

        assertThat(response.getStatusCode()).isEqualTo(HttpStatus.INTERNAL_SERVER_ERROR);
        assertThat(response.getBody()).containsEntry("error", "Internal server error");
    }
}
