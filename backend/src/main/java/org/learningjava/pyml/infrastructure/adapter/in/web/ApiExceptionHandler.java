package org.learningjava.pyml.infrastructure.adapter.in.web;

import jakarta.servlet.http.HttpServletRequest;
import org.learningjava.pyml.domain.error.ErrorKind;
import org.learningjava.pyml.domain.error.TranspileException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.web.bind.MethodArgumentNotValidException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;

import java.time.Instant;
import java.util.stream.Collectors;

@RestControllerAdvice
public class ApiExceptionHandler {

    private static final Logger log = LoggerFactory.getLogger(ApiExceptionHandler.class);

    // 400 for bad options, 422 for documents that do not transpile
    @ExceptionHandler(TranspileException.class)
    public ResponseEntity<ApiError> handleTranspile(TranspileException ex, HttpServletRequest req) {
        HttpStatus status = ex.kind() == ErrorKind.CONFIGURATION ? HttpStatus.BAD_REQUEST : HttpStatus.UNPROCESSABLE_ENTITY;
        return ResponseEntity.status(status).body(new ApiError(
                status.value(),
                status.getReasonPhrase(),
                ex.kind(),
                ex.line() > 0 ? ex.line() : null,
                ex.getMessage(),
                req.getRequestURI(),
                Instant.now()
        ));
    }

    // 400 - @Valid on the request body
    @ExceptionHandler(MethodArgumentNotValidException.class)
    public ResponseEntity<ApiError> handleBodyValidation(MethodArgumentNotValidException ex, HttpServletRequest req) {
        String msg = ex.getBindingResult().getFieldErrors().stream()
                .map(fe -> fe.getField() + " " + fe.getDefaultMessage())
                .collect(Collectors.joining(", "));
        return badRequest(msg, req);
    }

    @ExceptionHandler(HttpMessageNotReadableException.class)
    public ResponseEntity<ApiError> handleUnreadable(HttpMessageNotReadableException ex, HttpServletRequest req) {
        return badRequest("Malformed request body", req);
    }

    // 500 - fallback
    @ExceptionHandler(Exception.class)
    public ResponseEntity<ApiError> handleGeneric(Exception ex, HttpServletRequest req) {
        log.error("Unhandled error on {}", req.getRequestURI(), ex);
        return ResponseEntity.status(HttpStatus.INTERNAL_SERVER_ERROR).body(new ApiError(
                500, "Internal Server Error", null, null, ex.getMessage(), req.getRequestURI(), Instant.now()
        ));
    }

    private static ResponseEntity<ApiError> badRequest(String msg, HttpServletRequest req) {
        return ResponseEntity.badRequest().body(
                new ApiError(400, "Bad Request", null, null, msg, req.getRequestURI(), Instant.now())
        );
    }
}
