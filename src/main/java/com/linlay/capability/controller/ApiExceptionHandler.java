package com.linlay.capability.controller;

import com.linlay.capability.catalog.CatalogException;
import com.linlay.capability.catalog.FrontmatterException;
import com.linlay.capability.catalog.InvalidResourceException;
import com.linlay.capability.catalog.InvalidResourceNameException;
import com.linlay.capability.catalog.ResourceAlreadyRegisteredException;
import com.linlay.capability.catalog.ResourceFileNotFoundException;
import com.linlay.capability.catalog.ResourceNotFoundException;
import com.linlay.capability.model.api.ApiResponse;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.validation.FieldError;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import org.springframework.web.bind.support.WebExchangeBindException;
import org.springframework.web.server.ServerWebInputException;

import java.util.HashMap;
import java.util.Map;

@RestControllerAdvice
public class ApiExceptionHandler {

    private static final Logger log = LoggerFactory.getLogger(ApiExceptionHandler.class);

    @ExceptionHandler(InvalidResourceNameException.class)
    public ResponseEntity<ApiResponse<Map<String, Object>>> handleInvalidName(InvalidResourceNameException ex) {
        return ResponseEntity.status(HttpStatus.BAD_REQUEST)
                .body(ApiResponse.failure(
                        HttpStatus.BAD_REQUEST.value(),
                        ex.getMessage(),
                        Map.of("reason", ex.reason().name())
                ));
    }

    @ExceptionHandler({InvalidResourceException.class, FrontmatterException.class})
    public ResponseEntity<ApiResponse<Map<String, Object>>> handleInvalidResource(CatalogException ex) {
        return failure(HttpStatus.BAD_REQUEST, ex.getMessage());
    }

    @ExceptionHandler({ResourceNotFoundException.class, ResourceFileNotFoundException.class})
    public ResponseEntity<ApiResponse<Map<String, Object>>> handleNotFound(CatalogException ex) {
        return failure(HttpStatus.NOT_FOUND, ex.getMessage());
    }

    @ExceptionHandler(ResourceAlreadyRegisteredException.class)
    public ResponseEntity<ApiResponse<Map<String, Object>>> handleConflict(ResourceAlreadyRegisteredException ex) {
        return failure(HttpStatus.CONFLICT, ex.getMessage());
    }

    @ExceptionHandler(WebExchangeBindException.class)
    public ResponseEntity<ApiResponse<Map<String, Object>>> handleValidation(WebExchangeBindException ex) {
        Map<String, String> fields = new HashMap<>();
        for (FieldError fieldError : ex.getBindingResult().getFieldErrors()) {
            fields.put(fieldError.getField(), fieldError.getDefaultMessage());
        }
        Map<String, Object> data = Map.of("fields", fields);
        return ResponseEntity.status(HttpStatus.BAD_REQUEST)
                .body(ApiResponse.failure(HttpStatus.BAD_REQUEST.value(), "Validation failed", data));
    }

    @ExceptionHandler(ServerWebInputException.class)
    public ResponseEntity<ApiResponse<Map<String, Object>>> handleInput(ServerWebInputException ex) {
        String reason = ex.getReason();
        return failure(HttpStatus.BAD_REQUEST, reason == null || reason.isBlank() ? "Bad request" : reason);
    }

    @ExceptionHandler(Exception.class)
    public ResponseEntity<ApiResponse<Map<String, Object>>> handleUnexpected(Exception ex) {
        log.error("Unhandled catalog API error", ex);
        return failure(HttpStatus.INTERNAL_SERVER_ERROR, "Internal server error");
    }

    private ResponseEntity<ApiResponse<Map<String, Object>>> failure(HttpStatus status, String message) {
        return ResponseEntity.status(status)
                .body(ApiResponse.failure(status.value(), message));
    }
}
