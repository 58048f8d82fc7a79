package com.tennis.features.api.exception;

import com.tennis.features.api.dto.ApiError;
import com.tennis.features.engine.replay.ReplayAbortedException;
import jakarta.servlet.http.HttpServletRequest;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.MissingServletRequestParameterException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import org.springframework.web.method.annotation.MethodArgumentTypeMismatchException;
import org.springframework.web.servlet.resource.NoResourceFoundException;

/**
 * Maps feature and replay failures onto {@link ApiError} bodies.
 *
 * 400 for bad query input, 404 for unknown matches, 409 while a replay holds the lock,
 * 503 before the first snapshot is published and 500 for an aborted replay.
 */
@RestControllerAdvice
public class GlobalExceptionHandler {

    private static final Logger log = LoggerFactory.getLogger(GlobalExceptionHandler.class);

    @ExceptionHandler({
            MissingServletRequestParameterException.class,
            MethodArgumentTypeMismatchException.class,
            IllegalArgumentException.class
    })
    public ResponseEntity<ApiError> handleBadQuery(Exception e, HttpServletRequest request) {
        if (e instanceof MissingServletRequestParameterException missing) {
            return error(HttpStatus.BAD_REQUEST, "MISSING_PARAMETER",
                    "Missing required parameter: " + missing.getParameterName(), request);
        }
        if (e instanceof MethodArgumentTypeMismatchException mismatch) {
            return error(HttpStatus.BAD_REQUEST, "INVALID_PARAMETER",
                    "Invalid value for parameter '" + mismatch.getName() + "': " + mismatch.getValue(), request);
        }
        return error(HttpStatus.BAD_REQUEST, "BAD_REQUEST", e.getMessage(), request);
    }

    @ExceptionHandler(ResourceNotFoundException.class)
    public ResponseEntity<ApiError> handleUnknownMatch(ResourceNotFoundException e, HttpServletRequest request) {
        return error(HttpStatus.NOT_FOUND, "NOT_FOUND", e.getMessage(), request);
    }

    @ExceptionHandler(ReplayInProgressException.class)
    public ResponseEntity<ApiError> handleReplayBusy(ReplayInProgressException e, HttpServletRequest request) {
        log.debug("Rejected {} while a replay is running", request.getRequestURI());
        return error(HttpStatus.CONFLICT, "CONFLICT", e.getMessage(), request);
    }

    @ExceptionHandler(SnapshotUnavailableException.class)
    public ResponseEntity<ApiError> handleNoSnapshot(SnapshotUnavailableException e, HttpServletRequest request) {
        return error(HttpStatus.SERVICE_UNAVAILABLE, "SNAPSHOT_UNAVAILABLE", e.getMessage(), request);
    }

    @ExceptionHandler(ReplayAbortedException.class)
    public ResponseEntity<ApiError> handleReplayAborted(ReplayAbortedException e, HttpServletRequest request) {
        log.error("Replay aborted at match {}, previous snapshot stays live: {}", e.getMatchId(), e.getMessage());
        return error(HttpStatus.INTERNAL_SERVER_ERROR, "REPLAY_ABORTED", e.getMessage(), request);
    }

    @ExceptionHandler(NoResourceFoundException.class)
    public ResponseEntity<Void> handleStaticResource(NoResourceFoundException e) {
        return ResponseEntity.notFound().build();
    }

    @ExceptionHandler(Exception.class)
    public ResponseEntity<ApiError> handleUnexpected(Exception e, HttpServletRequest request) {
        log.error("Unexpected error on {}: {}", request.getRequestURI(), e.getMessage(), e);
        return error(HttpStatus.INTERNAL_SERVER_ERROR, "INTERNAL_ERROR", "An unexpected error occurred", request);
    }

    private static ResponseEntity<ApiError> error(HttpStatus status, String code, String message,
                                                  HttpServletRequest request) {
        return ResponseEntity.status(status).body(new ApiError(code, message, request.getRequestURI()));
    }
}
