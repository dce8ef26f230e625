package com.example.realtime.gateway.service;

import com.example.realtime.shared.config.AppProperties;
import com.example.realtime.shared.model.DiscussionSubscription;
import com.example.realtime.shared.store.PresenceStore;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Service;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Scheduler;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.LinkedHashSet;
import java.util.Map;
import java.util.Set;

/**
 * Which connections listen to which discussion, kept in both directions as independent records.
 * The pair is written topic side first; a crash in between leaves a half pair that the reaper or TTL removes.
 */
@Service
@Slf4j
@RequiredArgsConstructor
public class SubscriptionIndex {

    private final PresenceStore presenceStore;
    private final AppProperties appProperties;
    private final Clock clock;
    @Qualifier("presenceScheduler")
    private final Scheduler presenceScheduler;

    public Mono<Void> join(String discussionId, String connectionId, String userId) {
        return Mono.fromRunnable(() -> {
                    Instant now = clock.instant();
                    Duration ttl = appProperties.getPresence().getConnectionTtl();
                    DiscussionSubscription subscription = DiscussionSubscription.builder()
                            .discussionId(discussionId)
                            .connectionId(connectionId)
                            .userId(userId)
                            .joinedAt(now)
                            .expiresAt(now.plus(ttl))
                            .build();
                    presenceStore.saveTopicSubscriber(subscription, ttl);
                    presenceStore.saveConnectionTopic(subscription, ttl);
                    log.info("Connection {} joined discussion {}", connectionId, discussionId);
                })
                .subscribeOn(presenceScheduler)
                .onErrorResume(e -> {
                    log.warn("Failed to subscribe connection {} to discussion {}: {}",
                            connectionId, discussionId, e.getMessage());
                    return Mono.empty();
                })
                .then();
    }

    public Mono<Void> leave(String discussionId, String connectionId) {
        return Mono.fromRunnable(() -> removePair(discussionId, connectionId))
                .subscribeOn(presenceScheduler)
                .onErrorResume(e -> {
                    log.warn("Failed to unsubscribe connection {} from discussion {}: {}",
                            connectionId, discussionId, e.getMessage());
                    return Mono.empty();
                })
                .then();
    }

    /**
     * Removes every subscription pair the connection holds, expired or not.
     *
     * @return the discussions the connection was removed from
     */
    public Mono<Set<String>> leaveAll(String connectionId) {
        return Mono.fromCallable(() -> {
                    Set<String> discussions = new LinkedHashSet<>(presenceStore.findConnectionTopics(connectionId).keySet());
                    for (String discussionId : discussions) {
                        removePair(discussionId, connectionId);
                    }
                    return discussions;
                })
                .subscribeOn(presenceScheduler)
                .onErrorResume(e -> {
                    log.warn("Failed to remove subscriptions of connection {}: {}", connectionId, e.getMessage());
                    return Mono.just(Set.of());
                });
    }

    /**
     * Current subscribers of a discussion. Entries that expired, or whose connection record is gone, are skipped
     * and pruned.
     */
    public Mono<Set<String>> subscribersOf(String discussionId) {
        return Mono.fromCallable(() -> {
                    Instant now = clock.instant();
                    Set<String> subscribers = new LinkedHashSet<>();
                    for (Map.Entry<String, DiscussionSubscription> entry : presenceStore.findTopicSubscribers(discussionId).entrySet()) {
                        String connectionId = entry.getKey();
                        boolean alive = !entry.getValue().isExpiredAt(now)
                                && presenceStore.findConnection(connectionId).filter(c -> !c.isExpiredAt(now)).isPresent();
                        if (alive) {
                            subscribers.add(connectionId);
                        } else {
                            pruneStale(discussionId, connectionId);
                        }
                    }
                    return subscribers;
                })
                .subscribeOn(presenceScheduler)
                .onErrorResume(e -> {
                    log.warn("Failed to resolve subscribers of discussion {}: {}", discussionId, e.getMessage());
                    return Mono.just(Set.of());
                });
    }

    public Mono<Set<String>> topicsOf(String connectionId) {
        return Mono.fromCallable(() -> {
                    Instant now = clock.instant();
                    Set<String> topics = new LinkedHashSet<>();
                    presenceStore.findConnectionTopics(connectionId).forEach((discussionId, subscription) -> {
                        if (!subscription.isExpiredAt(now)) {
                            topics.add(discussionId);
                        }
                    });
                    return topics;
                })
                .subscribeOn(presenceScheduler)
                .onErrorResume(e -> {
                    log.warn("Failed to resolve discussions of connection {}: {}", connectionId, e.getMessage());
                    return Mono.just(Set.of());
                });
    }

    private void removePair(String discussionId, String connectionId) {
        presenceStore.deleteTopicSubscriber(discussionId, connectionId);
        presenceStore.deleteConnectionTopic(connectionId, discussionId);
        log.debug("Connection {} removed from discussion {}", connectionId, discussionId);
    }

    private void pruneStale(String discussionId, String connectionId) {
        try {
            removePair(discussionId, connectionId);
        } catch (RuntimeException e) {
            log.warn("Failed to prune stale subscription {} -> {}: {}", discussionId, connectionId, e.getMessage());
        }
    }
}
