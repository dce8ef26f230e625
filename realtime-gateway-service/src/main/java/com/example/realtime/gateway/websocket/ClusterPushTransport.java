package com.example.realtime.gateway.websocket;

import com.example.realtime.gateway.dto.RelayedDelivery;
import com.example.realtime.gateway.service.ConnectionRegistry;
import com.example.realtime.shared.config.AppProperties;
import com.example.realtime.shared.exception.ConnectionGoneException;
import com.example.realtime.shared.exception.TransientDeliveryException;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.annotation.Primary;
import org.springframework.stereotype.Component;
import reactor.core.publisher.Mono;

/**
 * Push transport seen by the dispatcher. Sockets held on this pod are written directly; anything else is
 * looked up in the registry and relayed to the pod recorded as its owner.
 * <p>
 * A connection is reported gone only when no live record exists or the record names this pod. A connection
 * owned by a pod that does not answer is a transient failure; its record lapses through the TTL if the pod
 * really died.
 */
@Component
@Primary
@Slf4j
@RequiredArgsConstructor
public class ClusterPushTransport implements PushTransport {

    private final WebSocketSessionManager localSessions;
    private final ConnectionRegistry connectionRegistry;
    private final PodRelay podRelay;
    private final AppProperties appProperties;

    @Override
    public Mono<Void> send(String connectionId, String payload) {
        return localSessions.send(connectionId, payload)
                .onErrorResume(ConnectionGoneException.class, notLocal -> sendToOwner(connectionId, payload, notLocal));
    }

    private Mono<Void> sendToOwner(String connectionId, String payload, ConnectionGoneException notLocal) {
        String localPod = appProperties.getPodName();
        return connectionRegistry.find(connectionId)
                .switchIfEmpty(Mono.error(notLocal))
                .flatMap(record -> {
                    String owner = record.getPodId();
                    if (owner == null || owner.equals(localPod)) {
                        return Mono.<Void>error(notLocal);
                    }
                    RelayedDelivery delivery = RelayedDelivery.builder()
                            .connectionId(connectionId)
                            .payload(payload)
                            .originPodId(localPod)
                            .build();
                    return podRelay.relay(owner, delivery)
                            .onErrorMap(e -> new TransientDeliveryException(connectionId,
                                    "Relay to pod " + owner + " failed: " + e.getMessage(), e))
                            .flatMap(received -> received
                                    ? Mono.<Void>empty()
                                    : Mono.<Void>error(new TransientDeliveryException(connectionId,
                                            "No listener on pod " + owner + " for connection " + connectionId)));
                });
    }
}
