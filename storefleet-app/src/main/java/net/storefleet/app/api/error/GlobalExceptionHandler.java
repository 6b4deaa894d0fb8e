package net.storefleet.app.api.error;

import jakarta.servlet.http.HttpServletRequest;
import net.storefleet.core.error.AlreadyInFlightException;
import net.storefleet.core.error.InfrastructureException;
import net.storefleet.core.error.ResourceExhaustedException;
import net.storefleet.core.error.StepFailedException;
import net.storefleet.core.error.TenantValidationException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.MethodArgumentNotValidException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;

import java.time.Instant;
import java.util.HashMap;
import java.util.Map;

@RestControllerAdvice
public class GlobalExceptionHandler {
    private static final Logger log = LoggerFactory.getLogger(GlobalExceptionHandler.class);

    private ApiError build(ErrorCode code, String msg, String cid, Map<String, Object> details) {
        return new ApiError(Instant.now(), code, msg, cid, details);
    }

    private String cid(HttpServletRequest req) {
        return req.getHeader("X-Correlation-Id");
    }

    @ExceptionHandler(MethodArgumentNotValidException.class)
    public ResponseEntity<ApiError> handleValidation(MethodArgumentNotValidException ex,
                                                     HttpServletRequest req) {
        Map<String, Object> fields = new HashMap<>();
        ex.getBindingResult().getFieldErrors()
                .forEach(fe -> fields.put(fe.getField(), fe.getDefaultMessage()));
        return ResponseEntity.badRequest().body(
                build(ErrorCode.BAD_REQUEST, "Validation error", cid(req), Map.of("fieldErrors", fields)));
    }

    @ExceptionHandler(TenantValidationException.class)
    public ResponseEntity<ApiError> handleTenantValidation(TenantValidationException ex,
                                                           HttpServletRequest req) {
        return ResponseEntity.badRequest().body(
                build(ErrorCode.BAD_REQUEST, ex.getMessage(), cid(req), Map.of("kind", ex.kind())));
    }

    @ExceptionHandler(AlreadyInFlightException.class)
    public ResponseEntity<ApiError> handleInFlight(AlreadyInFlightException ex, HttpServletRequest req) {
        Map<String, Object> details = new HashMap<>();
        details.put("tenantId", ex.tenantId());
        if (ex.existingJobId() != null) details.put("jobId", ex.existingJobId());
        return ResponseEntity.status(HttpStatus.CONFLICT).body(
                build(ErrorCode.ALREADY_IN_FLIGHT, ex.getMessage(), cid(req), details));
    }

    @ExceptionHandler(ResourceExhaustedException.class)
    public ResponseEntity<ApiError> handleExhausted(ResourceExhaustedException ex, HttpServletRequest req) {
        log.warn("capacity exhausted: {}", ex.getMessage());
        return ResponseEntity.status(HttpStatus.SERVICE_UNAVAILABLE).body(
                build(ErrorCode.RESOURCE_EXHAUSTED, ex.getMessage(), cid(req), Map.of("kind", ex.kind())));
    }

    @ExceptionHandler(InfrastructureException.class)
    public ResponseEntity<ApiError> handleInfrastructure(InfrastructureException ex, HttpServletRequest req) {
        log.warn("infrastructure failure: {}", ex.getMessage());
        return ResponseEntity.status(HttpStatus.BAD_GATEWAY).body(
                build(ErrorCode.INFRASTRUCTURE, ex.getMessage(), cid(req), Map.of("kind", ex.kind())));
    }

    @ExceptionHandler(StepFailedException.class)
    public ResponseEntity<ApiError> handleStepFailed(StepFailedException ex, HttpServletRequest req) {
        return ResponseEntity.status(HttpStatus.BAD_GATEWAY).body(
                build(ErrorCode.STEP_FAILED, ex.getMessage(), cid(req), Map.of("kind", ex.kind())));
    }

    @ExceptionHandler(NotFoundException.class)
    public ResponseEntity<ApiError> handleNotFound(NotFoundException ex, HttpServletRequest req) {
        return ResponseEntity.status(HttpStatus.NOT_FOUND).body(
                build(ex.code(), ex.getMessage(), cid(req), Map.of()));
    }

    @ExceptionHandler(IllegalArgumentException.class)
    public ResponseEntity<ApiError> handleIllegalArg(IllegalArgumentException ex, HttpServletRequest req) {
        return ResponseEntity.status(HttpStatus.BAD_REQUEST).body(
                build(ErrorCode.BAD_REQUEST, ex.getMessage(), cid(req), Map.of()));
    }

    @ExceptionHandler(Exception.class)
    public ResponseEntity<ApiError> handleAny(Exception ex, HttpServletRequest req) {
        log.error("unhandled error on {} {}", req.getMethod(), req.getRequestURI(), ex);
        return ResponseEntity.status(HttpStatus.INTERNAL_SERVER_ERROR).body(
                build(ErrorCode.INTERNAL_ERROR, ex.getMessage(), cid(req), Map.of()));
    }
}
