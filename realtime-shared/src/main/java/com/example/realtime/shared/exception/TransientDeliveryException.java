package com.example.realtime.shared.exception;

import lombok.Getter;

/**
 * Delivery failed but the endpoint may still be alive (buffer overflow, contention).
 */
@Getter
public class TransientDeliveryException extends RuntimeException {

    private final String connectionId;

    public TransientDeliveryException(String connectionId, String message) {
        super(message);
        this.connectionId = connectionId;
    }

    public TransientDeliveryException(String connectionId, String message, Throwable cause) {
        super(message, cause);
        this.connectionId = connectionId;
    }
}
