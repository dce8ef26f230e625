package com.example.realtime.shared.exception;

import lombok.Getter;

/**
 * The push endpoint for a connection is confirmed gone. Delivery to it will never succeed again.
 */
@Getter
public class ConnectionGoneException extends RuntimeException {

    private final String connectionId;

    public ConnectionGoneException(String connectionId) {
        super("Connection " + connectionId + " is gone");
        this.connectionId = connectionId;
    }

    public ConnectionGoneException(String connectionId, String reason) {
        super("Connection " + connectionId + " is gone: " + reason);
        this.connectionId = connectionId;
    }
}
