package com.example.realtime.gateway.websocket;

import com.example.realtime.gateway.dto.RelayedDelivery;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;
import reactor.core.publisher.Mono;

/**
 * The in-memory store is private to one pod, so there is never another pod to reach.
 */
@Component
@Slf4j
@ConditionalOnProperty(name = "realtime.presence.store", havingValue = "memory")
public class LocalOnlyPodRelay implements PodRelay {

    @Override
    public Mono<Boolean> relay(String podId, RelayedDelivery delivery) {
        log.debug("No relay available for connection {} on pod {}", delivery.getConnectionId(), podId);
        return Mono.just(false);
    }
}
