package com.example.realtime.shared.exception;

public class PresenceStoreException extends RuntimeException {

    public PresenceStoreException(String message, Throwable cause) {
        super(message, cause);
    }
}
