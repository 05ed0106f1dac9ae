package com.canonicalsync.api.rest;

import com.canonicalsync.core.exception.DuplicateActiveJobException;
import com.canonicalsync.core.exception.InvalidStateTransitionException;
import com.canonicalsync.core.exception.NotFoundException;
import com.canonicalsync.core.exception.SyncConfigurationException;
import com.canonicalsync.core.exception.SyncException;
import com.canonicalsync.core.exception.UpstreamUnavailableException;
import com.canonicalsync.core.exception.WorkflowFetchException;
import jakarta.servlet.http.HttpServletRequest;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.MissingServletRequestParameterException;
import org.springframework.web.bind.ServletRequestBindingException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import org.springframework.web.method.annotation.MethodArgumentTypeMismatchException;

/**
 * Renders errors as {@code {errorCode, message}}.
 */
@RestControllerAdvice
public class ApiExceptionHandler {

    private static final Logger log = LoggerFactory.getLogger(ApiExceptionHandler.class);

    static final String BAD_REQUEST = "BAD_REQUEST";
    static final String INTERNAL_ERROR = "INTERNAL_ERROR";

    @ExceptionHandler(NotFoundException.class)
    public ResponseEntity<ErrorResponse> handleNotFound(NotFoundException e) {
        return respond(HttpStatus.NOT_FOUND, e);
    }

    @ExceptionHandler(SyncConfigurationException.class)
    public ResponseEntity<ErrorResponse> handleConfiguration(SyncConfigurationException e) {
        return respond(HttpStatus.BAD_REQUEST, e);
    }

    @ExceptionHandler(UpstreamUnavailableException.class)
    public ResponseEntity<ErrorResponse> handleUpstream(UpstreamUnavailableException e) {
        log.warn("Upstream {} unavailable: {}", e.getUpstream(), e.getMessage());
        return respond(HttpStatus.BAD_GATEWAY, e);
    }

    @ExceptionHandler(WorkflowFetchException.class)
    public ResponseEntity<ErrorResponse> handleWorkflowFetch(WorkflowFetchException e) {
        log.warn("Could not fetch {}: {}", e.getItemId(), e.getMessage());
        return respond(HttpStatus.BAD_GATEWAY, e);
    }

    @ExceptionHandler({DuplicateActiveJobException.class, InvalidStateTransitionException.class})
    public ResponseEntity<ErrorResponse> handleConflict(SyncException e) {
        return respond(HttpStatus.CONFLICT, e);
    }

    @ExceptionHandler({
        MissingServletRequestParameterException.class,
        ServletRequestBindingException.class,
        MethodArgumentTypeMismatchException.class,
        IllegalArgumentException.class
    })
    public ResponseEntity<ErrorResponse> handleBadRequest(Exception e) {
        return ResponseEntity.status(HttpStatus.BAD_REQUEST)
            .body(new ErrorResponse(BAD_REQUEST, e.getMessage()));
    }

    @ExceptionHandler(Exception.class)
    public ResponseEntity<ErrorResponse> handleUnknown(Exception e, HttpServletRequest request) {
        log.error("Unhandled error on {} {}", request.getMethod(), request.getRequestURI(), e);
        return ResponseEntity.status(HttpStatus.INTERNAL_SERVER_ERROR)
            .body(new ErrorResponse(INTERNAL_ERROR, "Internal error"));
    }

    private ResponseEntity<ErrorResponse> respond(HttpStatus status, SyncException e) {
        return ResponseEntity.status(status).body(new ErrorResponse(e.getErrorCode(), e.getMessage()));
    }

    public record ErrorResponse(String errorCode, String message) {}
}
