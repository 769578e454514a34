package com.agentkernel.api.rest;

import com.agentkernel.core.exception.ClaimConflictException;
import com.agentkernel.core.exception.DuplicateTaskException;
import com.agentkernel.core.exception.FlowValidationException;
import com.agentkernel.core.exception.InvalidTransitionException;
import com.agentkernel.core.exception.KernelException;
import com.agentkernel.core.exception.MalformedTaskException;
import com.agentkernel.core.exception.MergeConflictException;
import com.agentkernel.core.exception.NotFoundException;
import com.agentkernel.core.exception.OptimisticLockException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import org.springframework.web.context.request.ServletWebRequest;
import org.springframework.web.context.request.WebRequest;

import java.time.Instant;
import java.util.Map;
import java.util.Set;

/**
 * Maps kernel error codes to HTTP statuses. The body always carries the
 * error code so clients can branch on it rather than on the message.
 */
@RestControllerAdvice
public class ApiExceptionHandler {

    private static final Logger log = LoggerFactory.getLogger(ApiExceptionHandler.class);

    private static final Map<String, HttpStatus> STATUS_BY_CODE = Map.of(
        NotFoundException.ERROR_CODE, HttpStatus.NOT_FOUND,
        ClaimConflictException.ERROR_CODE, HttpStatus.CONFLICT,
        OptimisticLockException.ERROR_CODE, HttpStatus.CONFLICT,
        DuplicateTaskException.ERROR_CODE, HttpStatus.CONFLICT,
        MergeConflictException.ERROR_CODE, HttpStatus.CONFLICT,
        InvalidTransitionException.ERROR_CODE, HttpStatus.BAD_REQUEST,
        MalformedTaskException.ERROR_CODE, HttpStatus.BAD_REQUEST,
        FlowValidationException.ERROR_CODE, HttpStatus.BAD_REQUEST
    );

    private static final Set<HttpStatus> EXPECTED = Set.of(HttpStatus.NOT_FOUND, HttpStatus.CONFLICT);

    @ExceptionHandler(KernelException.class)
    public ResponseEntity<ErrorResponse> handleKernelException(KernelException ex, WebRequest request) {
        HttpStatus status = STATUS_BY_CODE.getOrDefault(ex.getErrorCode(), HttpStatus.INTERNAL_SERVER_ERROR);
        if (status.is5xxServerError()) {
            log.error("Request failed [{}]: {}", ex.getErrorCode(), ex.getMessage(), ex);
        } else if (EXPECTED.contains(status)) {
            log.debug("Request rejected [{}]: {}", ex.getErrorCode(), ex.getMessage());
        } else {
            log.warn("Request rejected [{}]: {}", ex.getErrorCode(), ex.getMessage());
        }
        return build(status, ex.getErrorCode(), ex.getMessage(), request);
    }

    @ExceptionHandler(IllegalArgumentException.class)
    public ResponseEntity<ErrorResponse> handleIllegalArgument(IllegalArgumentException ex, WebRequest request) {
        log.warn("Invalid argument: {}", ex.getMessage());
        return build(HttpStatus.BAD_REQUEST, "INVALID_ARGUMENT", ex.getMessage(), request);
    }

    @ExceptionHandler(HttpMessageNotReadableException.class)
    public ResponseEntity<ErrorResponse> handleUnreadable(HttpMessageNotReadableException ex, WebRequest request) {
        log.warn("Unreadable request body: {}", ex.getMessage());
        return build(HttpStatus.BAD_REQUEST, "INVALID_REQUEST_BODY", "Request body is missing or malformed", request);
    }

    private ResponseEntity<ErrorResponse> build(HttpStatus status, String code, String message, WebRequest request) {
        String path = request instanceof ServletWebRequest servlet ? servlet.getRequest().getRequestURI() : null;
        ErrorResponse body = new ErrorResponse(Instant.now(), status.value(), code, message, path);
        return ResponseEntity.status(status).body(body);
    }

    public record ErrorResponse(
        Instant timestamp,
        int status,
        String errorCode,
        String message,
        String path
    ) {}
}
