package com.customdim.controller.rest;

import com.customdim.core.error.CustomDimensionException;
import com.customdim.core.error.InvalidExtractionException;
import jakarta.servlet.http.HttpServletRequest;
import java.time.OffsetDateTime;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.ProblemDetail;
import org.springframework.http.ResponseEntity;
import org.springframework.validation.FieldError;
import org.springframework.web.bind.MethodArgumentNotValidException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;

/**
 * Maps custom dimension failures to problem details carrying the stable error {@code code} and the
 * offending {@code field}.
 */
@RestControllerAdvice
public class RestErrorHandler {

    private static final Logger log = LoggerFactory.getLogger(RestErrorHandler.class);
    static final String INVALID_REQUEST = "custom-dimensions.invalid-request";

    @ExceptionHandler(CustomDimensionException.class)
    public ResponseEntity<ProblemDetail> handleCustomDimension(CustomDimensionException ex, HttpServletRequest request) {
        HttpStatus status = HttpStatus.valueOf(ex.getErrorCode().httpStatus());
        if (status.is5xxServerError()) {
            log.error("Custom dimension request failed: {} (path={})", ex.getMessage(), path(request), ex);
        } else {
            log.warn("Custom dimension request rejected: {} {} (path={})", ex.getErrorCode(), ex.getMessage(), path(request));
        }

        ProblemDetail problem = problem(status, ex.getMessage(), ex.getErrorCode().code(), ex.getField(), request);
        if (ex instanceof InvalidExtractionException iee) {
            problem.setProperty("reason", iee.getReason().name());
            problem.setProperty("ruleIndex", iee.getRuleIndex());
        }
        return ResponseEntity.status(status).body(problem);
    }

    @ExceptionHandler(MethodArgumentNotValidException.class)
    public ResponseEntity<ProblemDetail> handleValidation(MethodArgumentNotValidException ex, HttpServletRequest request) {
        FieldError fieldError = ex.getBindingResult().getFieldError();
        String field = fieldError == null ? null : fieldError.getField();
        String detail = fieldError == null ? "Validation failed" : field + " " + fieldError.getDefaultMessage();
        return ResponseEntity.badRequest().body(problem(HttpStatus.BAD_REQUEST, detail, INVALID_REQUEST, field, request));
    }

    private static ProblemDetail problem(
            HttpStatus status, String detail, String code, String field, HttpServletRequest request) {
        ProblemDetail problem = ProblemDetail.forStatusAndDetail(status, detail);
        problem.setTitle(status.getReasonPhrase());
        problem.setProperty("code", code);
        if (field != null) {
            problem.setProperty("field", field);
        }
        problem.setProperty("timestamp", OffsetDateTime.now());
        problem.setProperty("path", path(request));
        return problem;
    }

    private static String path(HttpServletRequest request) {
        return request != null ? request.getRequestURI() : "<unknown>";
    }
}
