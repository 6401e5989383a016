package com.pushcast.dispatcher.api;

import com.pushcast.dispatcher.api.dto.ApiError;
import com.pushcast.dispatcher.model.InvalidPayloadException;
import com.pushcast.dispatcher.store.StoreConsistencyException;
import com.pushcast.dispatcher.trigger.InvalidTriggerException;
import jakarta.servlet.http.HttpServletRequest;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.OptimisticLockingFailureException;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.web.ErrorResponseException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import org.springframework.web.method.annotation.MethodArgumentTypeMismatchException;

/**
 * Maps exceptions escaping the controllers to {@link ApiError} bodies.
 * Caller mistakes are 400, store conflicts 409.
 */
@RestControllerAdvice
public class ApiExceptionHandler {

    private static final Logger log = LoggerFactory.getLogger(ApiExceptionHandler.class);

    @ExceptionHandler(InvalidTriggerException.class)
    public ResponseEntity<ApiError> handleInvalidTrigger(InvalidTriggerException e, HttpServletRequest req) {
        return reject(400, "invalid-trigger", e.getMessage(), req);
    }

    @ExceptionHandler(InvalidPayloadException.class)
    public ResponseEntity<ApiError> handleInvalidPayload(InvalidPayloadException e, HttpServletRequest req) {
        return reject(400, "invalid-payload", e.getMessage(), req);
    }

    @ExceptionHandler({HttpMessageNotReadableException.class,
                       MethodArgumentTypeMismatchException.class,
                       IllegalArgumentException.class})
    public ResponseEntity<ApiError> handleBadInput(Exception e, HttpServletRequest req) {
        return reject(400, "invalid-input", e.getMessage(), req);
    }

    @ExceptionHandler({StoreConsistencyException.class, OptimisticLockingFailureException.class})
    public ResponseEntity<ApiError> handleConflict(RuntimeException e, HttpServletRequest req) {
        log.error("Store conflict on {} {}: {}", req.getMethod(), req.getRequestURI(), e.getMessage());
        return ResponseEntity.status(409).body(new ApiError(409, "store-conflict", e.getMessage()));
    }

    /** ResponseStatusException and the framework's own errors keep their status. */
    @ExceptionHandler(ErrorResponseException.class)
    public ResponseEntity<ApiError> handleFrameworkError(ErrorResponseException e, HttpServletRequest req) {
        int status = e.getStatusCode().value();
        ApiError body = new ApiError(status, e.getBody().getTitle(), e.getBody().getDetail());
        log.warn("{} {} returned {}: {}", req.getMethod(), req.getRequestURI(), status, e.getBody().getDetail());
        return ResponseEntity.status(status).body(body);
    }

    private static ResponseEntity<ApiError> reject(int status, String code, String message, HttpServletRequest req) {
        log.warn("Rejected {} {}: {} - {}", req.getMethod(), req.getRequestURI(), code, message);
        return ResponseEntity.status(status).body(new ApiError(status, code, message));
    }
}
