package com.example.realtime.gateway.websocket;

import com.example.realtime.gateway.dto.RelayedDelivery;
import reactor.core.publisher.Mono;

/**
 * Hands a frame to another gateway pod.
 * <p>
 * Emits {@code true} when at least one listener on the target pod received it, {@code false} when no pod
 * listens under that id.
 */
public interface PodRelay {

    Mono<Boolean> relay(String podId, RelayedDelivery delivery);
}
