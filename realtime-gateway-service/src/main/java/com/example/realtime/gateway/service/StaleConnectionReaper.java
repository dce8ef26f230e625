package com.example.realtime.gateway.service;

import com.example.realtime.shared.config.MonitoringConfig;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import reactor.core.publisher.Mono;

/**
 * Removes everything that still points at a dead connection. Safe to call repeatedly and concurrently;
 * every step tolerates records that are already gone.
 */
@Service
@Slf4j
@RequiredArgsConstructor
public class StaleConnectionReaper {

    private final ConnectionRegistry connectionRegistry;
    private final SubscriptionIndex subscriptionIndex;
    private final MonitoringConfig.RealtimeMetricsCollector metricsCollector;

    /**
     * Deletes the connection and its user links. With a discussion id only that subscription pair is removed,
     * without one every pair of the connection goes.
     */
    public Mono<Void> reap(String connectionId, String discussionId) {
        Mono<Void> subscriptions = discussionId != null
                ? subscriptionIndex.leave(discussionId, connectionId)
                : subscriptionIndex.leaveAll(connectionId).then();

        return connectionRegistry.close(connectionId)
                .then(subscriptions)
                .doOnSuccess(v -> {
                    metricsCollector.incrementCounter("realtime.connections.reaped",
                            "scope", discussionId != null ? "discussion" : "full");
                    log.info("Reaped connection {} ({})", connectionId,
                            discussionId != null ? "discussion " + discussionId : "all discussions");
                })
                .onErrorResume(e -> {
                    log.warn("Reap of connection {} did not complete: {}", connectionId, e.getMessage());
                    return Mono.empty();
                });
    }

    public Mono<Void> reap(String connectionId) {
        return reap(connectionId, null);
    }
}
