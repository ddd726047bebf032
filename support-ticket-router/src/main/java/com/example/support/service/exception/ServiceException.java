package com.example.support.service.exception;

import org.springframework.http.HttpStatus;

/**
 * Failure that maps onto an HTTP status and a machine readable code. Stack traces are only kept
 * for server-side failures.
 */
public abstract class ServiceException extends RuntimeException {

    private final HttpStatus status;
    private final String errorCode;

    protected ServiceException(HttpStatus status, String message, String errorCode) {
        this(status, message, errorCode, null);
    }

    protected ServiceException(HttpStatus status, String message, String errorCode, Throwable cause) {
        super(message, cause, false, status.is5xxServerError());
        this.status = status;
        this.errorCode = errorCode;
    }

    public HttpStatus getStatus() {
        return status;
    }

    public String getErrorCode() {
        return errorCode;
    }

    public boolean isServerError() {
        return status.is5xxServerError();
    }
}
