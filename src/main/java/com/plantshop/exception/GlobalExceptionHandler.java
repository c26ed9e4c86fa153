package com.plantshop.exception;

import com.plantshop.dto.ErrorResponse;
import com.plantshop.dto.ErrorsResponse;
import jakarta.servlet.http.HttpServletRequest;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import org.springframework.web.method.annotation.MethodArgumentTypeMismatchException;
import org.springframework.web.servlet.NoHandlerFoundException;
import org.springframework.web.servlet.resource.NoResourceFoundException;

/**
 * Maps every failure the API knows about onto one of its two error bodies.
 */
@RestControllerAdvice
@Slf4j
public class GlobalExceptionHandler {

    @ExceptionHandler(PlantNotFoundException.class)
    public ResponseEntity<ErrorResponse> handlePlantNotFound(PlantNotFoundException e) {
        log.debug("Plant {} does not exist", e.getPlantId());
        return notFound();
    }

    // No route matched, or {id} was not an integer (such a path never names a plant)
    @ExceptionHandler({NoHandlerFoundException.class, NoResourceFoundException.class,
            MethodArgumentTypeMismatchException.class})
    public ResponseEntity<ErrorResponse> handleUnmatchedRoute(Exception e, HttpServletRequest request) {
        log.debug("No plant route for {} {}", request.getMethod(), request.getRequestURI());
        return notFound();
    }

    @ExceptionHandler(PlantValidationException.class)
    public ResponseEntity<ErrorsResponse> handleValidation(PlantValidationException e) {
        log.warn("Rejected plant request: {}", e.getMessage());
        return ResponseEntity.badRequest().body(ErrorsResponse.of(e.getMessage()));
    }

    @ExceptionHandler(PlantStorageException.class)
    public ResponseEntity<ErrorsResponse> handleStorage(PlantStorageException e) {
        log.warn("Plant write failed", e);
        return ResponseEntity.badRequest().body(ErrorsResponse.of(e.getMessage()));
    }

    private ResponseEntity<ErrorResponse> notFound() {
        return ResponseEntity.status(HttpStatus.NOT_FOUND).body(ErrorResponse.plantNotFound());
    }
}
