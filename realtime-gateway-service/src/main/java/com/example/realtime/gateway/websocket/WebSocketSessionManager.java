package com.example.realtime.gateway.websocket;

import com.example.realtime.shared.dto.BroadcastEnvelope;
import com.example.realtime.shared.exception.ConnectionGoneException;
import com.example.realtime.shared.exception.TransientDeliveryException;
import com.example.realtime.shared.util.Constants.Actions;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import jakarta.annotation.PreDestroy;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;
import reactor.core.publisher.Sinks;

import java.time.Clock;
import java.time.Duration;
import java.util.ArrayList;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Owns the outbound sink of every WebSocket session open on this pod and writes to them. A connection id with
 * no sink here is reported as gone; {@link ClusterPushTransport} decides whether it lives on another pod.
 */
@Service
@Slf4j
@RequiredArgsConstructor
public class WebSocketSessionManager implements PushTransport {

    private static final Duration SERIALIZATION_SPIN = Duration.ofMillis(50);

    private final Map<String, Sinks.Many<String>> connectionSinks = new ConcurrentHashMap<>();

    private final ObjectMapper objectMapper;
    private final Clock clock;

    public Flux<String> createOutboundStream(String connectionId) {
        log.debug("Creating outbound stream for connection: {}", connectionId);
        Sinks.Many<String> sink = Sinks.many().unicast().onBackpressureBuffer();
        connectionSinks.put(connectionId, sink);
        return sink.asFlux()
                .doFinally(signalType -> removeOutboundStream(connectionId));
    }

    public void removeOutboundStream(String connectionId) {
        Sinks.Many<String> sink = connectionSinks.remove(connectionId);
        if (sink != null) {
            sink.tryEmitComplete();
            log.info("Closed outbound stream for connection {}", connectionId);
        }
    }

    @Override
    public Mono<Void> send(String connectionId, String payload) {
        return Mono.defer(() -> {
            Sinks.Many<String> sink = connectionSinks.get(connectionId);
            if (sink == null) {
                return Mono.error(new ConnectionGoneException(connectionId));
            }
            Sinks.EmitResult result = emit(sink, payload);
            if (result.isSuccess()) {
                return Mono.empty();
            }
            if (result == Sinks.EmitResult.FAIL_TERMINATED || result == Sinks.EmitResult.FAIL_CANCELLED) {
                connectionSinks.remove(connectionId, sink);
                return Mono.error(new ConnectionGoneException(connectionId, result.name()));
            }
            return Mono.error(new TransientDeliveryException(connectionId, "Failed to emit to connection " + connectionId + ": " + result));
        });
    }

    /**
     * Concurrent senders to the same sink spin briefly instead of failing with FAIL_NON_SERIALIZED.
     */
    private Sinks.EmitResult emit(Sinks.Many<String> sink, String payload) {
        long deadline = System.nanoTime() + SERIALIZATION_SPIN.toNanos();
        Sinks.EmitResult result = sink.tryEmitNext(payload);
        while (result == Sinks.EmitResult.FAIL_NON_SERIALIZED && System.nanoTime() < deadline) {
            Thread.onSpinWait();
            result = sink.tryEmitNext(payload);
        }
        return result;
    }

    public int getActiveConnectionCount() {
        return connectionSinks.size();
    }

    public boolean isConnectedLocally(String connectionId) {
        return connectionSinks.containsKey(connectionId);
    }

    @PreDestroy
    public void cleanup() {
        if (connectionSinks.isEmpty()) {
            return;
        }
        log.info("Sending shutdown notice to {} connected clients...", connectionSinks.size());
        String notice = shutdownNotice();
        for (String connectionId : new ArrayList<>(connectionSinks.keySet())) {
            Sinks.Many<String> sink = connectionSinks.remove(connectionId);
            if (sink != null) {
                if (notice != null) {
                    sink.tryEmitNext(notice);
                }
                sink.tryEmitComplete();
            }
        }
        log.info("WebSocketSessionManager cleanup complete.");
    }

    private String shutdownNotice() {
        try {
            return objectMapper.writeValueAsString(BroadcastEnvelope.of(
                    Actions.SERVER_SHUTDOWN,
                    Map.of("message", "Server is shutting down. Please reconnect momentarily."),
                    clock.instant()));
        } catch (JsonProcessingException e) {
            log.warn("Error serializing shutdown notice, closing streams without it", e);
            return null;
        }
    }
}
