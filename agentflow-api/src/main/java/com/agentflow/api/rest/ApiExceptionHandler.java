package com.agentflow.api.rest;

import com.agentflow.core.exception.DuplicateWorkerException;
import com.agentflow.core.exception.InvalidStateTransitionException;
import com.agentflow.core.exception.KeyCollisionException;
import com.agentflow.core.exception.NotFoundException;
import com.agentflow.core.exception.OrchestratorException;
import com.agentflow.core.exception.RunNotTerminalException;
import com.agentflow.core.exception.ShutdownInProgressException;
import com.agentflow.core.exception.UnknownWorkerException;
import com.agentflow.core.exception.WorkflowValidationException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import org.springframework.web.method.annotation.MethodArgumentTypeMismatchException;

/**
 * Translates orchestrator errors into JSON error bodies.
 */
@RestControllerAdvice
public class ApiExceptionHandler {

    private static final Logger log = LoggerFactory.getLogger(ApiExceptionHandler.class);

    static final String INVALID_REQUEST = "INVALID_REQUEST";
    static final String INTERNAL_ERROR = "INTERNAL_ERROR";

    @ExceptionHandler({NotFoundException.class, UnknownWorkerException.class})
    public ResponseEntity<ErrorResponse> handleNotFound(OrchestratorException e) {
        return respond(HttpStatus.NOT_FOUND, e.getErrorCode(), e.getMessage());
    }

    @ExceptionHandler({
        DuplicateWorkerException.class,
        KeyCollisionException.class,
        RunNotTerminalException.class,
        InvalidStateTransitionException.class
    })
    public ResponseEntity<ErrorResponse> handleConflict(OrchestratorException e) {
        return respond(HttpStatus.CONFLICT, e.getErrorCode(), e.getMessage());
    }

    @ExceptionHandler(WorkflowValidationException.class)
    public ResponseEntity<ErrorResponse> handleValidation(WorkflowValidationException e) {
        return respond(HttpStatus.BAD_REQUEST, e.getErrorCode(), e.getMessage());
    }

    @ExceptionHandler({
        IllegalArgumentException.class,
        HttpMessageNotReadableException.class,
        MethodArgumentTypeMismatchException.class
    })
    public ResponseEntity<ErrorResponse> handleBadRequest(Exception e) {
        return respond(HttpStatus.BAD_REQUEST, INVALID_REQUEST, e.getMessage());
    }

    @ExceptionHandler(ShutdownInProgressException.class)
    public ResponseEntity<ErrorResponse> handleUnavailable(ShutdownInProgressException e) {
        return respond(HttpStatus.SERVICE_UNAVAILABLE, e.getErrorCode(), e.getMessage());
    }

    @ExceptionHandler(IllegalStateException.class)
    public ResponseEntity<ErrorResponse> handleIllegalState(IllegalStateException e) {
        log.error("Request failed in an unexpected state", e);
        return respond(HttpStatus.INTERNAL_SERVER_ERROR, INTERNAL_ERROR, e.getMessage());
    }

    @ExceptionHandler(OrchestratorException.class)
    public ResponseEntity<ErrorResponse> handleOrchestratorError(OrchestratorException e) {
        log.error("Request failed: [{}] {}", e.getErrorCode(), e.getMessage(), e);
        return respond(HttpStatus.INTERNAL_SERVER_ERROR, e.getErrorCode(), e.getMessage());
    }

    private static ResponseEntity<ErrorResponse> respond(HttpStatus status, String errorCode, String message) {
        if (status.is4xxClientError()) {
            log.debug("Request rejected with {}: [{}] {}", status.value(), errorCode, message);
        }
        return ResponseEntity.status(status).body(new ErrorResponse(errorCode, message));
    }

    public record ErrorResponse(String errorCode, String message) {}
}
