package com.platform.planner.error;

/**
 * Transport level failure talking to the remote analysis service.
 * The HTTP status decides whether the failure is retryable.
 */
public class RemoteServiceException extends PlannerException {
    
    private final int statusCode;
    private final String operation;
    
    public RemoteServiceException(ErrorCode errorCode, int statusCode, String operation, String message) {
        super(errorCode, message);
        this.statusCode = statusCode;
        this.operation = operation;
    }
    
    public RemoteServiceException(ErrorCode errorCode, int statusCode, String operation, String message, Throwable cause) {
        super(errorCode, message, cause);
        this.statusCode = statusCode;
        this.operation = operation;
    }
    
    /**
     * Classifies an HTTP error status.
     */
    public static RemoteServiceException forStatus(int statusCode, String operation, String body) {
        ErrorCode code;
        if (statusCode == 502) {
            code = ErrorCode.REMOTE_BAD_GATEWAY;
        } else if (statusCode >= 500) {
            code = ErrorCode.REMOTE_SERVER_ERROR;
        } else {
            code = ErrorCode.REMOTE_CLIENT_ERROR;
        }
        return new RemoteServiceException(
            code,
            statusCode,
            operation,
            String.format("%s failed with HTTP %d: %s", operation, statusCode, body)
        );
    }
    
    public static RemoteServiceException unreachable(String operation, Throwable cause) {
        return new RemoteServiceException(
            ErrorCode.REMOTE_UNREACHABLE,
            0,
            operation,
            String.format("%s failed: %s", operation, cause.getMessage()),
            cause
        );
    }
    
    public static RemoteServiceException invalidResponse(String operation, Throwable cause) {
        return new RemoteServiceException(
            ErrorCode.REMOTE_RESPONSE_INVALID,
            0,
            operation,
            String.format("%s returned an unreadable response: %s", operation, cause.getMessage()),
            cause
        );
    }
    
    /**
     * Any 5xx status, including 502.
     */
    public boolean isServerError() {
        return statusCode >= 500 && statusCode < 600;
    }
    
    public boolean isBadGateway() {
        return statusCode == 502;
    }
    
    public boolean isClientError() {
        return statusCode >= 400 && statusCode < 500;
    }
    
    public int getStatusCode() {
        return statusCode;
    }
    
    public String getOperation() {
        return operation;
    }
}
