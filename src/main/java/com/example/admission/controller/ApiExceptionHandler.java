package com.example.admission.controller;

import com.example.admission.controller.dto.ErrorResponse;
import com.example.admission.exception.InvalidPolicyException;
import com.example.admission.exception.UnconfiguredException;
import com.example.admission.exception.UnknownLimitGroupException;
import jakarta.servlet.http.HttpServletRequest;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpStatus;
import org.springframework.http.HttpStatusCode;
import org.springframework.http.ProblemDetail;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import org.springframework.web.context.request.WebRequest;
import org.springframework.web.servlet.mvc.method.annotation.ResponseEntityExceptionHandler;

/**
 * Maps admission errors and Spring MVC's own exceptions to a {@code {"error": ...}} body.
 * <p>
 * Framework exceptions (unknown path, wrong method, unsupported media type, ...) keep the
 * status Spring MVC assigns them; only genuinely unexpected errors become 500.
 */
@RestControllerAdvice
public class ApiExceptionHandler extends ResponseEntityExceptionHandler {

    private static final Logger log = LoggerFactory.getLogger(ApiExceptionHandler.class);

    @ExceptionHandler(InvalidPolicyException.class)
    public ResponseEntity<ErrorResponse> handleInvalidPolicy(InvalidPolicyException ex) {
        return ResponseEntity.badRequest().body(new ErrorResponse(ex.getMessage()));
    }

    @ExceptionHandler(UnknownLimitGroupException.class)
    public ResponseEntity<ErrorResponse> handleUnknownGroup(UnknownLimitGroupException ex) {
        return ResponseEntity.status(HttpStatus.NOT_FOUND).body(new ErrorResponse(ex.getMessage()));
    }

    @ExceptionHandler(UnconfiguredException.class)
    public ResponseEntity<ErrorResponse> handleUnconfigured(UnconfiguredException ex) {
        return ResponseEntity.status(HttpStatus.SERVICE_UNAVAILABLE).body(new ErrorResponse(ex.getMessage()));
    }

    @ExceptionHandler(Exception.class)
    public ResponseEntity<ErrorResponse> handleUnexpected(Exception ex, HttpServletRequest request) {
        log.error("Unexpected error handling {} {}", request.getMethod(), request.getRequestURI(), ex);
        return ResponseEntity.status(HttpStatus.INTERNAL_SERVER_ERROR).body(new ErrorResponse("Internal server error"));
    }

    @Override
    protected ResponseEntity<Object> handleHttpMessageNotReadable(
            HttpMessageNotReadableException ex,
            HttpHeaders headers,
            HttpStatusCode status,
            WebRequest request
    ) {
        return handleExceptionInternal(ex, new ErrorResponse("Malformed request body"), headers, status, request);
    }

    @Override
    protected ResponseEntity<Object> handleExceptionInternal(
            Exception ex,
            Object body,
            HttpHeaders headers,
            HttpStatusCode statusCode,
            WebRequest request
    ) {
        Object payload = body;
        if (!(payload instanceof ErrorResponse)) {
            String message = ex.getMessage();
            if (body instanceof ProblemDetail problem && problem.getDetail() != null) {
                message = problem.getDetail();
            }
            payload = new ErrorResponse(message);
        }

        if (statusCode.is5xxServerError()) {
            log.error("Request failed with {}", statusCode.value(), ex);
        } else {
            log.debug("Request rejected with {}: {}", statusCode.value(), ex.getMessage());
        }
        return super.handleExceptionInternal(ex, payload, headers, statusCode, request);
    }
}
