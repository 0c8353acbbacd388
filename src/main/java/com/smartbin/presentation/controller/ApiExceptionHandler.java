package com.smartbin.presentation.controller;

import com.smartbin.domain.exception.ErrorKind;
import com.smartbin.domain.exception.ServiceException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataAccessException;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.web.HttpRequestMethodNotSupportedException;
import org.springframework.web.bind.MissingServletRequestParameterException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import org.springframework.web.method.annotation.MethodArgumentTypeMismatchException;
import org.springframework.web.servlet.resource.NoResourceFoundException;

import java.util.Map;

/**
 * Traduce las excepciones a respuestas JSON. Las fallas de almacenamiento e
 * inesperadas se loguean y responden con un mensaje genérico.
 */
@RestControllerAdvice
@Slf4j
public class ApiExceptionHandler {

    static final String GENERIC_ERROR = "Erro interno do servidor";

    @ExceptionHandler(ServiceException.class)
    public ResponseEntity<Map<String, Object>> handleService(ServiceException e) {
        if (e.getKind() == ErrorKind.STORAGE) {
            log.error("Falla de almacenamiento: {}", e.getMessage(), e);
            return ApiResponses.failure(ErrorKind.STORAGE, GENERIC_ERROR);
        }
        log.debug("Petición rechazada ({}): {}", e.getKind(), e.getMessage());
        return ApiResponses.failure(e.getKind(), e.getMessage());
    }

    @ExceptionHandler({
            HttpMessageNotReadableException.class,
            MethodArgumentTypeMismatchException.class,
            MissingServletRequestParameterException.class
    })
    public ResponseEntity<Map<String, Object>> handleBadRequest(Exception e) {
        log.debug("Petición malformada: {}", e.getMessage());
        return ApiResponses.failure(ErrorKind.VALIDATION, "Requisicao invalida");
    }

    @ExceptionHandler(NoResourceFoundException.class)
    public ResponseEntity<Map<String, Object>> handleNotFound(NoResourceFoundException e) {
        return ApiResponses.failure(ErrorKind.NOT_FOUND, "Endpoint nao encontrado");
    }

    @ExceptionHandler(HttpRequestMethodNotSupportedException.class)
    public ResponseEntity<Map<String, Object>> handleMethodNotAllowed(HttpRequestMethodNotSupportedException e) {
        return ApiResponses.failure(HttpStatus.METHOD_NOT_ALLOWED, ErrorKind.VALIDATION,
                "Metodo nao permitido: " + e.getMethod());
    }

    @ExceptionHandler(DataAccessException.class)
    public ResponseEntity<Map<String, Object>> handleDataAccess(DataAccessException e) {
        log.error("Error de base de datos: {}", e.getMessage(), e);
        return ApiResponses.failure(ErrorKind.STORAGE, GENERIC_ERROR);
    }

    @ExceptionHandler(Exception.class)
    public ResponseEntity<Map<String, Object>> handleUnexpected(Exception e) {
        log.error("Error inesperado: {}", e.getMessage(), e);
        return ApiResponses.failure(HttpStatus.INTERNAL_SERVER_ERROR, ErrorKind.STORAGE, GENERIC_ERROR);
    }
}
