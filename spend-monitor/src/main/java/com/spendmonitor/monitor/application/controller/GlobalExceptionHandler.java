package com.spendmonitor.monitor.application.controller;

import com.spendmonitor.monitor.domain.exceptions.InvalidDeviceTokenException;
import com.spendmonitor.monitor.domain.exceptions.DeviceNotFoundException;
import com.spendmonitor.monitor.domain.exceptions.NotFoundException;
import com.spendmonitor.monitor.domain.exceptions.RateLimitExceededException;
import com.spendmonitor.monitor.domain.exceptions.SpendMonitorException;
import com.spendmonitor.monitor.domain.exceptions.ValidationException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ProblemDetail;
import org.springframework.web.bind.MethodArgumentNotValidException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;

@Slf4j
@RestControllerAdvice
public class GlobalExceptionHandler {

    @ExceptionHandler(DeviceNotFoundException.class)
    public ProblemDetail handleDeviceNotFound(DeviceNotFoundException ex) {
        var problem = ProblemDetail.forStatusAndDetail(HttpStatus.NOT_FOUND, ex.getMessage());
        problem.setTitle("Device Not Found");
        problem.setProperty("code", ErrorCodes.DEVICE_NOT_FOUND);
        return problem;
    }

    @ExceptionHandler(NotFoundException.class)
    public ProblemDetail handleNotFound(NotFoundException ex) {
        var problem = ProblemDetail.forStatusAndDetail(HttpStatus.NOT_FOUND, ex.getMessage());
        problem.setTitle("Not Found");
        problem.setProperty("code", ErrorCodes.NOT_FOUND);
        return problem;
    }

    @ExceptionHandler(InvalidDeviceTokenException.class)
    public ProblemDetail handleInvalidToken(InvalidDeviceTokenException ex) {
        var problem = ProblemDetail.forStatusAndDetail(HttpStatus.BAD_REQUEST, ex.getMessage());
        problem.setTitle("Invalid Device Token");
        problem.setProperty("code", ErrorCodes.INVALID_DEVICE_TOKEN);
        return problem;
    }

    @ExceptionHandler(ValidationException.class)
    public ProblemDetail handleDomainValidation(ValidationException ex) {
        var problem = ProblemDetail.forStatusAndDetail(HttpStatus.BAD_REQUEST, ex.getMessage());
        problem.setTitle("Bad Request");
        problem.setProperty("code", ErrorCodes.VALIDATION_ERROR);
        return problem;
    }

    @ExceptionHandler(MethodArgumentNotValidException.class)
    public ProblemDetail handleValidation(MethodArgumentNotValidException ex) {
        var problem = ProblemDetail.forStatusAndDetail(HttpStatus.BAD_REQUEST, "Validation failed");
        problem.setTitle("Bad Request");
        problem.setProperty("code", ErrorCodes.VALIDATION_ERROR);
        var errors = ex.getBindingResult().getFieldErrors().stream()
                .map(fe -> fe.getField() + ": " + fe.getDefaultMessage())
                .toList();
        problem.setProperty("errors", errors);
        return problem;
    }

    @ExceptionHandler(RateLimitExceededException.class)
    public ProblemDetail handleRateLimited(RateLimitExceededException ex) {
        var problem = ProblemDetail.forStatusAndDetail(HttpStatus.TOO_MANY_REQUESTS, ex.getMessage());
        problem.setTitle("Too Many Requests");
        problem.setProperty("code", ErrorCodes.RATE_LIMITED);
        return problem;
    }

    @ExceptionHandler(SpendMonitorException.class)
    public ProblemDetail handleBackend(SpendMonitorException ex) {
        var status = switch (ex.kind()) {
            case TRANSIENT, RETRY_EXHAUSTED, DEADLINE_EXCEEDED -> HttpStatus.SERVICE_UNAVAILABLE;
            case FATAL -> HttpStatus.BAD_GATEWAY;
            default -> HttpStatus.INTERNAL_SERVER_ERROR;
        };
        log.warn("Request failed: kind={} error={}", ex.kind(), ex.getMessage());
        var problem = ProblemDetail.forStatusAndDetail(status, ex.getMessage());
        problem.setTitle(status.getReasonPhrase());
        problem.setProperty("code", switch (status) {
            case BAD_GATEWAY -> ErrorCodes.BACKEND_REJECTED;
            case SERVICE_UNAVAILABLE -> ErrorCodes.BACKEND_UNAVAILABLE;
            default -> ErrorCodes.INTERNAL_ERROR;
        });
        problem.setProperty("kind", ex.kind().name());
        return problem;
    }

    @ExceptionHandler(Exception.class)
    public ProblemDetail handleUnexpected(Exception ex) {
        log.error("Unexpected error", ex);
        var problem = ProblemDetail.forStatusAndDetail(HttpStatus.INTERNAL_SERVER_ERROR, "Internal server error");
        problem.setTitle("Internal Server Error");
        problem.setProperty("code", ErrorCodes.INTERNAL_ERROR);
        return problem;
    }
}
