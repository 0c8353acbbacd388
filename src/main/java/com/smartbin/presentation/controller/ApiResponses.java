package com.smartbin.presentation.controller;

import com.smartbin.domain.exception.ErrorKind;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Construcción de las respuestas JSON de la API ({@code success},
 * {@code message}, datos) y tabla de códigos HTTP por tipo de error.
 */
public final class ApiResponses {

    private ApiResponses() {
    }

    public static Map<String, Object> body(boolean success) {
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("success", success);
        return body;
    }

    public static ResponseEntity<Map<String, Object>> ok(String key, Object value) {
        Map<String, Object> body = body(true);
        body.put(key, value);
        return ResponseEntity.ok(body);
    }

    public static ResponseEntity<Map<String, Object>> message(String message) {
        Map<String, Object> body = body(true);
        body.put("message", message);
        return ResponseEntity.ok(body);
    }

    public static ResponseEntity<Map<String, Object>> failure(ErrorKind kind, String message) {
        return failure(statusOf(kind), kind, message);
    }

    public static ResponseEntity<Map<String, Object>> failure(HttpStatus status, ErrorKind kind, String message) {
        Map<String, Object> body = body(false);
        body.put("error", kind.name());
        body.put("message", message);
        return ResponseEntity.status(status).body(body);
    }

    /**
     * Código HTTP por defecto de cada tipo de error.
     */
    public static HttpStatus statusOf(ErrorKind kind) {
        return switch (kind) {
            case VALIDATION, NO_SECRET_PENDING, INVALID_CODE -> HttpStatus.BAD_REQUEST;
            case USER_NOT_FOUND, USER_DISABLED, WRONG_PASSWORD, UNAUTHORIZED -> HttpStatus.UNAUTHORIZED;
            case FORBIDDEN -> HttpStatus.FORBIDDEN;
            case NOT_FOUND -> HttpStatus.NOT_FOUND;
            case CONFLICT -> HttpStatus.CONFLICT;
            case INSUFFICIENT_DATA -> HttpStatus.UNPROCESSABLE_ENTITY;
            case NO_DATA, MFA_NOT_REQUIRED -> HttpStatus.OK;
            case STORAGE -> HttpStatus.INTERNAL_SERVER_ERROR;
        };
    }
}
