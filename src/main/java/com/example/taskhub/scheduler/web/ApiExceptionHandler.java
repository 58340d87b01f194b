package com.example.taskhub.scheduler.web;

import com.example.taskhub.scheduler.exception.*;
import com.example.taskhub.scheduler.web.dto.ErrorResponse;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.validation.FieldError;
import org.springframework.web.bind.MethodArgumentNotValidException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import org.springframework.web.method.annotation.MethodArgumentTypeMismatchException;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * 异常 -> HTTP 状态：校验类 400，不存在 404，状态冲突 409，存储不可用 503。
 */
@Slf4j
@RestControllerAdvice
public class ApiExceptionHandler {

    @ExceptionHandler(ParameterValidationException.class)
    public ResponseEntity<ErrorResponse> parameterValidation(ParameterValidationException e) {
        log.warn("Parameter validation failed: {}", e.getMessage());
        return body(HttpStatus.BAD_REQUEST, "PARAMETER_VALIDATION", e.getMessage(), e.getProblems());
    }

    @ExceptionHandler(InvalidCronExpressionException.class)
    public ResponseEntity<ErrorResponse> invalidCron(InvalidCronExpressionException e) {
        log.warn("Invalid cron expression: {}", e.getMessage());
        return body(HttpStatus.BAD_REQUEST, "INVALID_CRON_EXPRESSION", e.getMessage(), null);
    }

    @ExceptionHandler(UnknownTaskException.class)
    public ResponseEntity<ErrorResponse> unknownTask(UnknownTaskException e) {
        log.warn("Unknown task: {}", e.getMessage());
        return body(HttpStatus.BAD_REQUEST, "UNKNOWN_TASK", e.getMessage(), null);
    }

    @ExceptionHandler(MethodArgumentNotValidException.class)
    public ResponseEntity<ErrorResponse> invalidBody(MethodArgumentNotValidException e) {
        List<String> details = new ArrayList<>();
        for (FieldError fe : e.getBindingResult().getFieldErrors()) {
            details.add(fe.getField() + ": " + fe.getDefaultMessage());
        }
        return body(HttpStatus.BAD_REQUEST, "VALIDATION", "Request body is invalid", details);
    }

    @ExceptionHandler({HttpMessageNotReadableException.class, IllegalArgumentException.class})
    public ResponseEntity<ErrorResponse> badRequest(Exception e) {
        return body(HttpStatus.BAD_REQUEST, "BAD_REQUEST", e.getMessage(), null);
    }

    @ExceptionHandler(MethodArgumentTypeMismatchException.class)
    public ResponseEntity<ErrorResponse> badParameter(MethodArgumentTypeMismatchException e) {
        return body(HttpStatus.BAD_REQUEST, "BAD_REQUEST",
                "Invalid value '" + e.getValue() + "' for parameter '" + e.getName() + "'", null);
    }

    @ExceptionHandler({JobNotFoundException.class, ExecutionNotFoundException.class})
    public ResponseEntity<ErrorResponse> notFound(SchedulerException e) {
        return body(HttpStatus.NOT_FOUND, "NOT_FOUND", e.getMessage(), null);
    }

    @ExceptionHandler(IllegalJobStateException.class)
    public ResponseEntity<ErrorResponse> conflict(IllegalJobStateException e) {
        log.info("Rejected: {}", e.getMessage());
        return body(HttpStatus.CONFLICT, "ILLEGAL_STATE", e.getMessage(), null);
    }

    @ExceptionHandler(StoreUnavailableException.class)
    public ResponseEntity<ErrorResponse> storeUnavailable(StoreUnavailableException e) {
        log.error("Store unavailable", e);
        return body(HttpStatus.SERVICE_UNAVAILABLE, "STORE_UNAVAILABLE", e.getMessage(), null);
    }

    private static ResponseEntity<ErrorResponse> body(HttpStatus status, String error, String message, List<String> details) {
        return ResponseEntity.status(status).body(ErrorResponse.builder()
                .error(error)
                .message(message)
                .details(details == null ? Collections.emptyList() : details)
                .build());
    }
}
