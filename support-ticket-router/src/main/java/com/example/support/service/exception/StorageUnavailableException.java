package com.example.support.service.exception;

import org.springframework.http.HttpStatus;

/**
 * The store kept failing with transient errors until the retry budget ran out.
 */
public class StorageUnavailableException extends ServiceException {

    public StorageUnavailableException(String operation, Throwable cause) {
        super(HttpStatus.SERVICE_UNAVAILABLE,
                "Storage unavailable during %s".formatted(operation),
                "storage_unavailable",
                cause);
    }
}
