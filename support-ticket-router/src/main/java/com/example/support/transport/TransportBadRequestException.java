package com.example.support.transport;

/**
 * Malformed or unsupported content, an unknown or closed thread, or a missing permission.
 */
public class TransportBadRequestException extends TransportException {

    public TransportBadRequestException(String message) {
        super(message);
    }
}
