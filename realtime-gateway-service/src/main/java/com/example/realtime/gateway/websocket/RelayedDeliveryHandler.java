package com.example.realtime.gateway.websocket;

import com.example.realtime.gateway.dto.RelayedDelivery;
import com.example.realtime.gateway.service.StaleConnectionReaper;
import com.example.realtime.shared.exception.ConnectionGoneException;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import reactor.core.publisher.Mono;

/**
 * Delivers frames relayed from other pods to sockets held here. This pod owns the connection, so a missing
 * local session is a confirmed death and the connection is reaped.
 */
@Component
@Slf4j
@RequiredArgsConstructor
public class RelayedDeliveryHandler {

    private final WebSocketSessionManager sessionManager;
    private final StaleConnectionReaper reaper;

    public Mono<Void> deliver(RelayedDelivery delivery) {
        String connectionId = delivery.getConnectionId();
        return sessionManager.send(connectionId, delivery.getPayload())
                .onErrorResume(ConnectionGoneException.class, e -> {
                    log.info("Relayed frame from pod {} found connection {} gone, reaping",
                            delivery.getOriginPodId(), connectionId);
                    return reaper.reap(connectionId);
                })
                .onErrorResume(e -> {
                    log.warn("Relayed frame for connection {} not delivered: {}", connectionId, e.getMessage());
                    return Mono.empty();
                });
    }
}
