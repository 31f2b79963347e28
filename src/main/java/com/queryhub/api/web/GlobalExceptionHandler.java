package com.queryhub.api.web;

import com.queryhub.api.dto.ErrorResponse;
import com.queryhub.domain.error.InvalidQueryException;
import com.queryhub.domain.error.QueryException;
import jakarta.servlet.http.HttpServletRequest;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.validation.FieldError;
import org.springframework.web.bind.MethodArgumentNotValidException;
import org.springframework.web.bind.MissingServletRequestParameterException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;

import java.util.stream.Collectors;

@Slf4j
@RestControllerAdvice
@RequiredArgsConstructor
public class GlobalExceptionHandler {

    private final ErrorResponseMapper mapper;

    @ExceptionHandler(QueryException.class)
    public ResponseEntity<ErrorResponse> handleQueryException(QueryException e, HttpServletRequest request) {
        if (e.getKind().getHttpStatus() >= 500) {
            log.warn("Query failed ({}): {}", e.getKind().getCode(), e.getMessage());
        } else {
            log.info("Query rejected ({}): {}", e.getKind().getCode(), e.getMessage());
        }
        return respond(e, request);
    }

    @ExceptionHandler(CallerAuthenticationException.class)
    public ResponseEntity<ErrorResponse> handleAuthentication(CallerAuthenticationException e,
                                                              HttpServletRequest request) {
        log.info("Unauthenticated request to {}: {}", request.getRequestURI(), e.getMessage());
        return respond(e, request);
    }

    @ExceptionHandler(MethodArgumentNotValidException.class)
    public ResponseEntity<ErrorResponse> handleValidation(MethodArgumentNotValidException e,
                                                          HttpServletRequest request) {
        String reason = e.getBindingResult().getFieldErrors().stream()
                .map(FieldError::getDefaultMessage)
                .collect(Collectors.joining(", "));
        return respond(new InvalidQueryException(reason.isEmpty() ? "request is invalid" : reason), request);
    }

    @ExceptionHandler(HttpMessageNotReadableException.class)
    public ResponseEntity<ErrorResponse> handleUnreadable(HttpMessageNotReadableException e,
                                                          HttpServletRequest request) {
        return respond(new InvalidQueryException("request body is not valid JSON"), request);
    }

    @ExceptionHandler(MissingServletRequestParameterException.class)
    public ResponseEntity<ErrorResponse> handleMissingParameter(MissingServletRequestParameterException e,
                                                                HttpServletRequest request) {
        return respond(new InvalidQueryException(e.getParameterName() + " is required"), request);
    }

    @ExceptionHandler(Exception.class)
    public ResponseEntity<ErrorResponse> handleUnexpected(Exception e, HttpServletRequest request) {
        log.error("Unhandled error on {}: {}", request.getRequestURI(), e.getMessage(), e);
        return respond(e, request);
    }

    private ResponseEntity<ErrorResponse> respond(Throwable error, HttpServletRequest request) {
        ErrorResponseMapper.MappedError mapped = mapper.map(error, TraceIdFilter.currentTraceId(request));
        return ResponseEntity.status(mapped.getStatus())
                .headers(mapped.getHeaders())
                .body(mapped.getBody());
    }
}
