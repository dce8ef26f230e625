package com.example.realtime.gateway.service;

import com.example.realtime.gateway.dto.DeliveryReport;
import com.example.realtime.gateway.websocket.PushTransport;
import com.example.realtime.shared.config.AppProperties;
import com.example.realtime.shared.config.MonitoringConfig;
import com.example.realtime.shared.dto.BroadcastEnvelope;
import com.example.realtime.shared.exception.ConnectionGoneException;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;
import reactor.util.function.Tuple2;
import reactor.util.function.Tuples;

import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * Fans an envelope out to every subscriber of a discussion, or to every connection of a user.
 * <p>
 * Deliveries run concurrently and settle independently; one subscriber failing never affects the others and
 * the returned {@link DeliveryReport} is emitted only after all of them settled. A connection reported gone by
 * the transport is reaped, any other failure is logged and left alone.
 */
@Service
@Slf4j
@RequiredArgsConstructor
public class BroadcastDispatcher {

    private enum Outcome { DELIVERED, GONE, FAILED }

    private final SubscriptionIndex subscriptionIndex;
    private final ConnectionRegistry connectionRegistry;
    private final StaleConnectionReaper reaper;
    private final PushTransport pushTransport;
    private final ObjectMapper objectMapper;
    private final AppProperties appProperties;
    private final MonitoringConfig.RealtimeMetricsCollector metricsCollector;

    public Mono<DeliveryReport> broadcast(String discussionId, BroadcastEnvelope envelope, String excludeConnectionId) {
        return subscriptionIndex.subscribersOf(discussionId)
                .flatMap(subscribers -> {
                    Set<String> targets = new LinkedHashSet<>(subscribers);
                    if (excludeConnectionId != null) {
                        targets.remove(excludeConnectionId);
                    }
                    return fanOut(discussionId, targets, envelope, discussionId);
                })
                .doOnNext(report -> log.debug("Broadcast {} to discussion {}: {}", envelope.getAction(), discussionId, report));
    }

    public Mono<DeliveryReport> broadcast(String discussionId, BroadcastEnvelope envelope) {
        return broadcast(discussionId, envelope, envelope.getOriginConnectionId());
    }

    /**
     * Delivers to every live connection of a user. Gone connections are reaped from all discussions.
     */
    public Mono<DeliveryReport> broadcastToUser(String userId, BroadcastEnvelope envelope) {
        return connectionRegistry.connectionsForUser(userId)
                .flatMap(connections -> fanOut("user:" + userId, connections, envelope, null));
    }

    /**
     * Sends a reply to a single connection, outside of any discussion.
     */
    public Mono<Void> sendTo(String connectionId, BroadcastEnvelope envelope) {
        return Mono.fromCallable(() -> serialize(envelope))
                .flatMap(payload -> pushTransport.send(connectionId, payload))
                .onErrorResume(e -> {
                    log.warn("Reply {} to connection {} not delivered: {}", envelope.getAction(), connectionId, e.getMessage());
                    return Mono.empty();
                });
    }

    private Mono<DeliveryReport> fanOut(String target, Set<String> connections, BroadcastEnvelope envelope,
                                        String reapScope) {
        if (connections.isEmpty()) {
            return Mono.just(DeliveryReport.empty(target));
        }

        String payload;
        try {
            payload = serialize(envelope);
        } catch (JsonProcessingException e) {
            log.error("Envelope {} for {} could not be serialized: {}", envelope.getAction(), target, e.getMessage());
            return Mono.just(DeliveryReport.builder().target(target).attempted(connections.size()).failed(connections).build());
        }

        long start = System.currentTimeMillis();
        int concurrency = appProperties.getDispatch().getConcurrency();

        return Flux.fromIterable(connections)
                .flatMap(connectionId -> deliver(connectionId, payload, reapScope), concurrency)
                .collectList()
                .map(outcomes -> toReport(target, connections.size(), outcomes))
                .doOnNext(report -> {
                    metricsCollector.recordTimer("realtime.broadcast.latency", System.currentTimeMillis() - start,
                            "action", envelope.getAction());
                    metricsCollector.incrementCounter("realtime.broadcast.delivered", report.getDelivered().size(),
                            "action", envelope.getAction());
                    if (!report.getGone().isEmpty() || !report.getFailed().isEmpty()) {
                        log.info("Fan-out to {} settled: {} delivered, {} gone, {} failed", target,
                                report.getDelivered().size(), report.getGone().size(), report.getFailed().size());
                    }
                });
    }

    private Mono<Tuple2<String, Outcome>> deliver(String connectionId, String payload, String reapScope) {
        return pushTransport.send(connectionId, payload)
                .timeout(appProperties.getDispatch().getDeliveryTimeout())
                .thenReturn(Tuples.of(connectionId, Outcome.DELIVERED))
                .onErrorResume(ConnectionGoneException.class, e -> {
                    log.info("Connection {} is gone, reaping", connectionId);
                    return reaper.reap(connectionId, reapScope)
                            .thenReturn(Tuples.of(connectionId, Outcome.GONE));
                })
                .onErrorResume(e -> {
                    log.warn("Transient delivery failure to connection {}: {}", connectionId, e.getMessage());
                    return Mono.just(Tuples.of(connectionId, Outcome.FAILED));
                });
    }

    private DeliveryReport toReport(String target, int attempted, List<Tuple2<String, Outcome>> outcomes) {
        Set<String> delivered = new LinkedHashSet<>();
        Set<String> gone = new LinkedHashSet<>();
        Set<String> failed = new LinkedHashSet<>();
        for (Tuple2<String, Outcome> outcome : outcomes) {
            switch (outcome.getT2()) {
                case DELIVERED -> delivered.add(outcome.getT1());
                case GONE -> gone.add(outcome.getT1());
                case FAILED -> failed.add(outcome.getT1());
            }
        }
        return DeliveryReport.builder()
                .target(target)
                .attempted(attempted)
                .delivered(delivered)
                .gone(gone)
                .failed(failed)
                .build();
    }

    private String serialize(BroadcastEnvelope envelope) throws JsonProcessingException {
        return objectMapper.writeValueAsString(envelope);
    }
}
