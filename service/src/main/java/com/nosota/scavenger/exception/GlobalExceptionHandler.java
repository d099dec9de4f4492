package com.nosota.scavenger.exception;

import com.nosota.scavenger.dto.ErrorResponse;
import com.nosota.scavenger.error.InsufficientBudgetException;
import com.nosota.scavenger.error.InvalidInputException;
import com.nosota.scavenger.error.InvalidStateException;
import com.nosota.scavenger.error.RecordNotFoundException;
import com.nosota.scavenger.error.RewardOverflowException;
import com.nosota.scavenger.error.ScavengerException;
import com.nosota.scavenger.error.UnauthorizedOperationException;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.validation.ConstraintViolationException;
import lombok.extern.slf4j.Slf4j;
import org.slf4j.MDC;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.MethodArgumentNotValidException;
import org.springframework.web.bind.MissingServletRequestParameterException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import org.springframework.web.method.annotation.MethodArgumentTypeMismatchException;

import java.util.stream.Collectors;

@RestControllerAdvice
@Slf4j
public class GlobalExceptionHandler {

    @ExceptionHandler(RecordNotFoundException.class)
    public ResponseEntity<ErrorResponse> handleNotFound(
            RecordNotFoundException ex, HttpServletRequest request) {
        return businessError(HttpStatus.NOT_FOUND, "Not Found", ex, request);
    }

    @ExceptionHandler(UnauthorizedOperationException.class)
    public ResponseEntity<ErrorResponse> handleUnauthorized(
            UnauthorizedOperationException ex, HttpServletRequest request) {
        return businessError(HttpStatus.FORBIDDEN, "Unauthorized Operation", ex, request);
    }

    @ExceptionHandler(InvalidInputException.class)
    public ResponseEntity<ErrorResponse> handleInvalidInput(
            InvalidInputException ex, HttpServletRequest request) {
        return businessError(HttpStatus.BAD_REQUEST, "Invalid Input", ex, request);
    }

    @ExceptionHandler(InvalidStateException.class)
    public ResponseEntity<ErrorResponse> handleInvalidState(
            InvalidStateException ex, HttpServletRequest request) {
        return businessError(HttpStatus.CONFLICT, "Invalid State", ex, request);
    }

    @ExceptionHandler(InsufficientBudgetException.class)
    public ResponseEntity<ErrorResponse> handleInsufficientBudget(
            InsufficientBudgetException ex, HttpServletRequest request) {
        return businessError(HttpStatus.UNPROCESSABLE_ENTITY, "Insufficient Budget", ex, request);
    }

    @ExceptionHandler(RewardOverflowException.class)
    public ResponseEntity<ErrorResponse> handleOverflow(
            RewardOverflowException ex, HttpServletRequest request) {
        return businessError(HttpStatus.UNPROCESSABLE_ENTITY, "Arithmetic Overflow", ex, request);
    }

    @ExceptionHandler(MethodArgumentNotValidException.class)
    public ResponseEntity<ErrorResponse> handleMethodArgumentNotValid(
            MethodArgumentNotValidException ex, HttpServletRequest request) {
        String message = ex.getBindingResult().getFieldErrors().stream()
                .map(error -> error.getField() + ": " + error.getDefaultMessage())
                .collect(Collectors.joining(", "));
        return validationError(message, request);
    }

    @ExceptionHandler(ConstraintViolationException.class)
    public ResponseEntity<ErrorResponse> handleConstraintViolation(
            ConstraintViolationException ex, HttpServletRequest request) {
        return validationError(ex.getMessage(), request);
    }

    @ExceptionHandler({MissingServletRequestParameterException.class, MethodArgumentTypeMismatchException.class})
    public ResponseEntity<ErrorResponse> handleBadParameter(
            Exception ex, HttpServletRequest request) {
        return validationError(ex.getMessage(), request);
    }

    @ExceptionHandler(IllegalArgumentException.class)
    public ResponseEntity<ErrorResponse> handleIllegalArgument(
            IllegalArgumentException ex, HttpServletRequest request) {
        return validationError(ex.getMessage(), request);
    }

    @ExceptionHandler(Exception.class)
    public ResponseEntity<ErrorResponse> handleGenericException(
            Exception ex, HttpServletRequest request) {
        String correlationId = MDC.get("correlationId");
        log.error("Unexpected error [correlationId={}]", correlationId, ex);

        ErrorResponse error = ErrorResponse.of(
                HttpStatus.INTERNAL_SERVER_ERROR.value(),
                "Internal Server Error",
                "INTERNAL",
                "An unexpected error occurred. Please contact support with correlation ID: " + correlationId,
                request.getRequestURI()
        );
        return ResponseEntity.status(HttpStatus.INTERNAL_SERVER_ERROR).body(error);
    }

    private ResponseEntity<ErrorResponse> businessError(
            HttpStatus status, String title, ScavengerException ex, HttpServletRequest request) {
        String correlationId = MDC.get("correlationId");
        log.warn("{} [correlationId={}]: {}", title, correlationId, ex.getMessage());

        ErrorResponse error = ErrorResponse.of(
                status.value(),
                title,
                ex.getCode(),
                ex.getMessage(),
                request.getRequestURI()
        );
        return ResponseEntity.status(status).body(error);
    }

    private ResponseEntity<ErrorResponse> validationError(String message, HttpServletRequest request) {
        String correlationId = MDC.get("correlationId");
        log.warn("Validation failed [correlationId={}]: {}", correlationId, message);

        ErrorResponse error = ErrorResponse.of(
                HttpStatus.BAD_REQUEST.value(),
                "Validation Failed",
                "INVALID_INPUT",
                message,
                request.getRequestURI()
        );
        return ResponseEntity.status(HttpStatus.BAD_REQUEST).body(error);
    }
}
