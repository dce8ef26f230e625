package com.example.realtime.gateway.websocket;

import reactor.core.publisher.Mono;

/**
 * Pushes a serialized frame to one connection.
 * <p>
 * The returned Mono errors with {@link com.example.realtime.shared.exception.ConnectionGoneException} when the
 * endpoint is permanently gone, and with any other exception for failures that may heal on their own.
 */
public interface PushTransport {

    Mono<Void> send(String connectionId, String payload);
}
