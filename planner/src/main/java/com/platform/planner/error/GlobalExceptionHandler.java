package com.platform.planner.error;

import com.platform.planner.observability.PlannerMetrics;
import jakarta.servlet.http.HttpServletRequest;
import lombok.extern.slf4j.Slf4j;
import org.slf4j.MDC;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.web.bind.MethodArgumentNotValidException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;

import java.time.Instant;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.UUID;

/**
 * Global exception handler for all REST controllers.
 * 
 * Converts exceptions to a standardized ErrorResponse, logs them with a
 * severity matching their category and counts them.
 */
@Slf4j
@RestControllerAdvice
public class GlobalExceptionHandler {
    
    private final PlannerMetrics metrics;
    
    public GlobalExceptionHandler(PlannerMetrics metrics) {
        this.metrics = metrics;
    }
    
    // ==================== Planner Exceptions ====================
    
    @ExceptionHandler(PlannerException.class)
    public ResponseEntity<ErrorResponse> handlePlannerException(
            PlannerException ex, HttpServletRequest request) {
        
        String traceId = getOrCreateTraceId();
        ErrorCode errorCode = ex.getErrorCode();
        HttpStatus status = mapErrorCodeToStatus(errorCode);
        
        if (status.is5xxServerError()) {
            log.error("[{}] {} {}: {}", traceId, errorCode.getCode(), errorCode.name(), ex.getMessage(), ex);
        } else {
            log.warn("[{}] {} {}: {}", traceId, errorCode.getCode(), errorCode.name(), ex.getMessage());
        }
        metrics.recordError(errorCode);
        
        ErrorResponse response = ErrorResponse.builder()
            .code(errorCode.getCode())
            .message(ex.getMessage())
            .detail(ex.getCause() != null ? ex.getCause().getMessage() : null)
            .fatal(errorCode.isFatal())
            .status(status.value())
            .timestamp(Instant.now())
            .path(request.getRequestURI())
            .traceId(traceId)
            .metadata(metadata(ex))
            .build();
        
        return ResponseEntity.status(status).body(response);
    }
    
    @ExceptionHandler(PlanSpecValidationException.class)
    public ResponseEntity<ErrorResponse> handleValidation(
            PlanSpecValidationException ex, HttpServletRequest request) {
        
        String traceId = getOrCreateTraceId();
        
        log.warn("[{}] Validation error: {}", traceId, ex.getMessage());
        metrics.recordError(ex.getErrorCode());
        
        ErrorResponse.ErrorResponseBuilder builder = ErrorResponse.builder()
            .code(ex.getErrorCode().getCode())
            .message(ex.getMessage())
            .fatal(true)
            .status(HttpStatus.BAD_REQUEST.value())
            .timestamp(Instant.now())
            .path(request.getRequestURI())
            .traceId(traceId);
        
        if (ex.getField() != null) {
            builder.fieldErrors(List.of(
                ErrorResponse.FieldError.builder()
                    .field(ex.getField())
                    .message(ex.getMessage())
                    .rejectedValue(ex.getRejectedValue())
                    .build()
            ));
        }
        
        return ResponseEntity.badRequest().body(builder.build());
    }
    
    // ==================== Request Errors ====================
    
    @ExceptionHandler(MethodArgumentNotValidException.class)
    public ResponseEntity<ErrorResponse> handleMethodArgumentNotValid(
            MethodArgumentNotValidException ex, HttpServletRequest request) {
        
        String traceId = getOrCreateTraceId();
        
        List<ErrorResponse.FieldError> fieldErrors = ex.getBindingResult()
            .getFieldErrors()
            .stream()
            .map(fe -> ErrorResponse.FieldError.builder()
                .field(fe.getField())
                .message(fe.getDefaultMessage())
                .rejectedValue(fe.getRejectedValue())
                .build())
            .toList();
        
        log.warn("[{}] Validation failed: {} field errors", traceId, fieldErrors.size());
        metrics.recordError(ErrorCode.INVALID_PLAN_SPEC);
        
        ErrorResponse response = ErrorResponse.builder()
            .code(ErrorCode.INVALID_PLAN_SPEC.getCode())
            .message("Validation failed")
            .fatal(true)
            .status(HttpStatus.BAD_REQUEST.value())
            .timestamp(Instant.now())
            .path(request.getRequestURI())
            .traceId(traceId)
            .fieldErrors(fieldErrors)
            .build();
        
        return ResponseEntity.badRequest().body(response);
    }
    
    @ExceptionHandler({HttpMessageNotReadableException.class, IllegalArgumentException.class})
    public ResponseEntity<ErrorResponse> handleInvalidRequest(
            Exception ex, HttpServletRequest request) {
        
        String traceId = getOrCreateTraceId();
        
        log.warn("[{}] Invalid request: {}", traceId, ex.getMessage());
        metrics.recordError(ErrorCode.INVALID_REQUEST);
        
        ErrorResponse response = ErrorResponse.builder()
            .code(ErrorCode.INVALID_REQUEST.getCode())
            .message("Invalid request")
            .detail(ex.getMessage())
            .fatal(true)
            .status(HttpStatus.BAD_REQUEST.value())
            .timestamp(Instant.now())
            .path(request.getRequestURI())
            .traceId(traceId)
            .build();
        
        return ResponseEntity.badRequest().body(response);
    }
    
    @ExceptionHandler(Exception.class)
    public ResponseEntity<ErrorResponse> handleUnexpected(
            Exception ex, HttpServletRequest request) {
        
        String traceId = getOrCreateTraceId();
        
        log.error("[{}] FATAL: Unexpected error: {}", traceId, ex.getMessage(), ex);
        metrics.recordError(ErrorCode.INTERNAL_ERROR);
        
        ErrorResponse response = ErrorResponse.builder()
            .code(ErrorCode.INTERNAL_ERROR.getCode())
            .message(ErrorCode.INTERNAL_ERROR.getDefaultMessage())
            .fatal(true)
            .status(HttpStatus.INTERNAL_SERVER_ERROR.value())
            .timestamp(Instant.now())
            .path(request.getRequestURI())
            .traceId(traceId)
            .build();
        
        return ResponseEntity.status(HttpStatus.INTERNAL_SERVER_ERROR).body(response);
    }
    
    // ==================== Helpers ====================
    
    static HttpStatus mapErrorCodeToStatus(ErrorCode errorCode) {
        return switch (errorCode) {
            case INVALID_PLAN_SPEC, MISSING_REQUIRED_FIELD, INVALID_FIELD_VALUE, INVALID_REQUEST -> HttpStatus.BAD_REQUEST;
            case VERSION_UNSUPPORTED, VERSION_UNKNOWN, SETTING_NOT_MAPPED,
                 SUBSTITUTION_UNRESOLVED, VALUE_MAP_INVALID -> HttpStatus.UNPROCESSABLE_ENTITY;
            case REMOTE_CLIENT_ERROR, REMOTE_SERVER_ERROR, REMOTE_BAD_GATEWAY,
                 REMOTE_RESPONSE_INVALID -> HttpStatus.BAD_GATEWAY;
            case REMOTE_UNREACHABLE -> HttpStatus.SERVICE_UNAVAILABLE;
            case PLAN_NOT_FOUND -> HttpStatus.NOT_FOUND;
            case MARKET_PROTECTED -> HttpStatus.FORBIDDEN;
            case MARKET_NOT_INITIALIZED -> HttpStatus.CONFLICT;
            default -> HttpStatus.INTERNAL_SERVER_ERROR;
        };
    }
    
    private Map<String, Object> metadata(PlannerException ex) {
        Map<String, Object> metadata = new HashMap<>();
        if (ex instanceof RemoteServiceException remote) {
            metadata.put("operation", remote.getOperation());
            metadata.put("remoteStatus", remote.getStatusCode());
        } else if (ex instanceof SettingsCompilationException compilation) {
            if (compilation.getTag() != null) {
                metadata.put("setting", compilation.getTag().name());
            }
            if (compilation.getField() != null) {
                metadata.put("field", compilation.getField());
            }
        } else if (ex instanceof InvalidMarketException market && market.getMarketName() != null) {
            metadata.put("market", market.getMarketName());
        }
        return metadata.isEmpty() ? null : metadata;
    }
    
    private String getOrCreateTraceId() {
        String traceId = MDC.get("correlationId");
        return traceId != null ? traceId : UUID.randomUUID().toString().substring(0, 8);
    }
}
