package com.supplyradar.api;

import com.supplyradar.api.dto.ErrorBody;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import org.springframework.web.server.ServerWebInputException;

/**
 * Maps bad input (unparseable dates, invalid ranges, missing token table) to 400 with ErrorBody.
 */
@Slf4j
@RestControllerAdvice
public class ApiExceptionHandler {

    @ExceptionHandler(IllegalArgumentException.class)
    public ResponseEntity<ErrorBody> handleIllegalArgument(IllegalArgumentException ex) {
        return ResponseEntity.badRequest().body(ErrorBody.of("INVALID_REQUEST", ex.getMessage()));
    }

    @ExceptionHandler(ServerWebInputException.class)
    public ResponseEntity<ErrorBody> handleInput(ServerWebInputException ex) {
        log.debug("Rejected request input: {}", ex.getMessage());
        String param = ex.getMethodParameter() != null ? ex.getMethodParameter().getParameterName() : null;
        String message = param != null ? "Invalid value for '" + param + "', expected YYYY-MM-DD" : ex.getReason();
        return ResponseEntity.badRequest().body(ErrorBody.of("INVALID_REQUEST", message));
    }
}
