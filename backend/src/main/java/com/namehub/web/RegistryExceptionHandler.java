package com.namehub.web;

import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;

@RestControllerAdvice
public class RegistryExceptionHandler {

    @ExceptionHandler(RegistryException.class)
    public ResponseEntity<RegistryErrorResponse> handle(RegistryException ex) {
        return ResponseEntity
                .status(ex.getStatus())
                .body(new RegistryErrorResponse(ex.getCode().name(), ex.getMessage()));
    }

    public record RegistryErrorResponse(
            String code,
            String message
    ) {
    }
}
