package com.example.support.transport;

/**
 * The target blocked the transport or cannot be reached at all.
 */
public class TransportForbiddenException extends TransportException {

    private final boolean targetBot;

    public TransportForbiddenException(String message, boolean targetBot) {
        super(message);
        this.targetBot = targetBot;
    }

    public boolean isTargetBot() {
        return targetBot;
    }
}
