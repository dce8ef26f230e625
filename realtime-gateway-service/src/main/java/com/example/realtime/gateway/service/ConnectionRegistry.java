package com.example.realtime.gateway.service;

import com.example.realtime.shared.config.AppProperties;
import com.example.realtime.shared.exception.PresenceStoreException;
import com.example.realtime.shared.model.ConnectionRecord;
import com.example.realtime.shared.model.UserConnectionLink;
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
import java.util.Optional;
import java.util.Set;

/**
 * Tracks live transport connections and which connections belong to which user.
 * <p>
 * Writes are best-effort: a store failure is logged and the caller sees an ordinary completion, so presence
 * bookkeeping never fails the action that triggered it.
 */
@Service
@Slf4j
@RequiredArgsConstructor
public class ConnectionRegistry {

    private final PresenceStore presenceStore;
    private final AppProperties appProperties;
    private final Clock clock;
    @Qualifier("presenceScheduler")
    private final Scheduler presenceScheduler;

    /**
     * Records a newly opened connection, plus a user link when the session authenticated. Re-opening an
     * existing id overwrites its timestamps.
     */
    public Mono<Void> open(String connectionId, String userId) {
        return Mono.fromRunnable(() -> {
                    Instant now = clock.instant();
                    Duration ttl = appProperties.getPresence().getConnectionTtl();
                    Instant expiresAt = now.plus(ttl);

                    presenceStore.saveConnection(ConnectionRecord.builder()
                            .connectionId(connectionId)
                            .userId(userId)
                            .podId(appProperties.getPodName())
                            .connectedAt(now)
                            .lastActivityAt(now)
                            .expiresAt(expiresAt)
                            .build(), ttl);

                    if (userId != null) {
                        presenceStore.saveUserLink(UserConnectionLink.builder()
                                .userId(userId)
                                .connectionId(connectionId)
                                .connectedAt(now)
                                .expiresAt(expiresAt)
                                .build(), ttl);
                    }
                    log.info("Connection {} registered (user: {})", connectionId, userId != null ? userId : "anonymous");
                })
                .subscribeOn(presenceScheduler)
                .onErrorResume(e -> {
                    log.warn("Failed to register connection {}: {}", connectionId, e.getMessage());
                    return Mono.empty();
                })
                .then();
    }

    /**
     * Refreshes the last-activity timestamp and returns the refreshed record. Completes empty when the
     * connection is unknown or expired. The expiry watermark is left as it is.
     *
     * @throws PresenceStoreException (as an error signal) when the record cannot be read
     */
    public Mono<ConnectionRecord> touch(String connectionId) {
        return Mono.fromCallable(() -> {
                    Instant now = clock.instant();
                    return readLive(connectionId, now).map(record -> refresh(record, now));
                })
                .subscribeOn(presenceScheduler)
                .flatMap(Mono::justOrEmpty);
    }

    private ConnectionRecord refresh(ConnectionRecord record, Instant now) {
        ConnectionRecord refreshed = record.withLastActivityAt(now);
        Duration remaining = Duration.between(now, record.getExpiresAt());
        // Redis rejects an expiry below one millisecond; the record is about to lapse anyway.
        if (remaining.toMillis() < 1) {
            log.debug("Connection {} expires within a millisecond, last activity not persisted", record.getConnectionId());
            return refreshed;
        }
        try {
            presenceStore.saveConnection(refreshed, remaining);
        } catch (RuntimeException e) {
            log.warn("Failed to refresh last activity for connection {}: {}", record.getConnectionId(), e.getMessage());
        }
        return refreshed;
    }

    /**
     * Deletes the connection and every user link pointing at it. Missing records are fine.
     */
    public Mono<Void> close(String connectionId) {
        return Mono.fromRunnable(() -> {
                    Set<String> linkedUsers = new LinkedHashSet<>(presenceStore.findLinkedUsers(connectionId));
                    presenceStore.findConnection(connectionId)
                            .map(ConnectionRecord::getUserId)
                            .ifPresent(linkedUsers::add);

                    presenceStore.deleteConnection(connectionId);
                    for (String userId : linkedUsers) {
                        presenceStore.deleteUserLink(userId, connectionId);
                    }
                    log.debug("Connection {} closed, {} user link(s) removed", connectionId, linkedUsers.size());
                })
                .subscribeOn(presenceScheduler)
                .onErrorResume(e -> {
                    log.warn("Failed to close connection {}: {}", connectionId, e.getMessage());
                    return Mono.empty();
                })
                .then();
    }

    /**
     * Live connections of a user. Links whose connection record is gone or expired are pruned on the way.
     */
    public Mono<Set<String>> connectionsForUser(String userId) {
        return Mono.fromCallable(() -> {
                    Instant now = clock.instant();
                    Set<String> live = new LinkedHashSet<>();
                    for (Map.Entry<String, UserConnectionLink> entry : presenceStore.findUserLinks(userId).entrySet()) {
                        String connectionId = entry.getKey();
                        boolean alive = !entry.getValue().isExpiredAt(now)
                                && presenceStore.findConnection(connectionId).filter(c -> !c.isExpiredAt(now)).isPresent();
                        if (alive) {
                            live.add(connectionId);
                        } else {
                            pruneOrphanedLink(userId, connectionId);
                        }
                    }
                    return live;
                })
                .subscribeOn(presenceScheduler)
                .onErrorResume(e -> {
                    log.warn("Failed to load connections for user {}: {}", userId, e.getMessage());
                    return Mono.just(Set.of());
                });
    }

    public Mono<ConnectionRecord> find(String connectionId) {
        return Mono.fromCallable(() -> readLive(connectionId, clock.instant()))
                .subscribeOn(presenceScheduler)
                .flatMap(Mono::justOrEmpty);
    }

    public Mono<Long> countLiveConnections() {
        return Mono.fromCallable(() -> presenceStore.countConnections(clock.instant()))
                .subscribeOn(presenceScheduler)
                .onErrorMap(e -> !(e instanceof PresenceStoreException),
                        e -> new PresenceStoreException("Failed to count live connections", e));
    }

    private Optional<ConnectionRecord> readLive(String connectionId, Instant now) {
        try {
            return presenceStore.findConnection(connectionId).filter(record -> !record.isExpiredAt(now));
        } catch (RuntimeException e) {
            throw new PresenceStoreException("Failed to read connection " + connectionId, e);
        }
    }

    private void pruneOrphanedLink(String userId, String connectionId) {
        try {
            presenceStore.deleteUserLink(userId, connectionId);
            log.debug("Pruned orphaned link {} -> {}", userId, connectionId);
        } catch (RuntimeException e) {
            log.warn("Failed to prune orphaned link {} -> {}: {}", userId, connectionId, e.getMessage());
        }
    }
}
