package com.example.realtime.shared.store;

import com.example.realtime.shared.aspect.Monitored;
import com.example.realtime.shared.config.AppProperties;
import com.example.realtime.shared.model.ConnectionRecord;
import com.example.realtime.shared.model.DiscussionSubscription;
import com.example.realtime.shared.model.UserConnectionLink;
import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Service;

import java.time.Duration;
import java.time.Instant;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.function.Predicate;

/**
 * Single-node presence store. Caffeine's expire-after-write is the physical backstop; logical expiry is
 * carried by each record's {@code expiresAt}.
 */
@Service
@Slf4j
@Monitored("store")
@ConditionalOnProperty(name = "realtime.presence.store", havingValue = "memory")
public class CaffeinePresenceStore implements PresenceStore {

    private final Cache<String, ConnectionRecord> connections;
    private final Cache<String, Map<String, UserConnectionLink>> userLinks;
    private final Cache<String, Set<String>> connectionUsers;
    private final Cache<String, Map<String, DiscussionSubscription>> discussionSubscribers;
    private final Cache<String, Map<String, DiscussionSubscription>> connectionDiscussions;

    @Autowired
    public CaffeinePresenceStore(AppProperties appProperties) {
        this(appProperties.getPresence().getConnectionTtl(), appProperties.getPresence().getMaximumSize());
    }

    public CaffeinePresenceStore(Duration ttl, long maximumSize) {
        this.connections = newCache(ttl, maximumSize);
        this.userLinks = newCache(ttl, maximumSize);
        this.connectionUsers = newCache(ttl, maximumSize);
        this.discussionSubscribers = newCache(ttl, maximumSize);
        this.connectionDiscussions = newCache(ttl, maximumSize);
    }

    private static <V> Cache<String, V> newCache(Duration ttl, long maximumSize) {
        return Caffeine.newBuilder()
                .maximumSize(maximumSize)
                .expireAfterWrite(ttl)
                .build();
    }

    @Override
    public void saveConnection(ConnectionRecord record, Duration ttl) {
        connections.put(record.getConnectionId(), record);
    }

    @Override
    public Optional<ConnectionRecord> findConnection(String connectionId) {
        return Optional.ofNullable(connections.getIfPresent(connectionId));
    }

    @Override
    public void deleteConnection(String connectionId) {
        connections.invalidate(connectionId);
    }

    @Override
    public void saveUserLink(UserConnectionLink link, Duration ttl) {
        putField(userLinks, link.getUserId(), link.getConnectionId(), link);
        connectionUsers.asMap().compute(link.getConnectionId(), (k, users) -> {
            Set<String> updated = users != null ? users : ConcurrentHashMap.newKeySet();
            updated.add(link.getUserId());
            return updated;
        });
    }

    @Override
    public Map<String, UserConnectionLink> findUserLinks(String userId) {
        return copyOf(userLinks.getIfPresent(userId));
    }

    @Override
    public Set<String> findLinkedUsers(String connectionId) {
        Set<String> users = connectionUsers.getIfPresent(connectionId);
        return users != null ? Set.copyOf(users) : Set.of();
    }

    @Override
    public void deleteUserLink(String userId, String connectionId) {
        removeField(userLinks, userId, connectionId);
        connectionUsers.asMap().computeIfPresent(connectionId, (k, users) -> {
            users.remove(userId);
            return users.isEmpty() ? null : users;
        });
    }

    @Override
    public void saveTopicSubscriber(DiscussionSubscription subscription, Duration ttl) {
        putField(discussionSubscribers, subscription.getDiscussionId(), subscription.getConnectionId(), subscription);
    }

    @Override
    public void saveConnectionTopic(DiscussionSubscription subscription, Duration ttl) {
        putField(connectionDiscussions, subscription.getConnectionId(), subscription.getDiscussionId(), subscription);
    }

    @Override
    public Map<String, DiscussionSubscription> findTopicSubscribers(String discussionId) {
        return copyOf(discussionSubscribers.getIfPresent(discussionId));
    }

    @Override
    public Map<String, DiscussionSubscription> findConnectionTopics(String connectionId) {
        return copyOf(connectionDiscussions.getIfPresent(connectionId));
    }

    @Override
    public void deleteTopicSubscriber(String discussionId, String connectionId) {
        removeField(discussionSubscribers, discussionId, connectionId);
    }

    @Override
    public void deleteConnectionTopic(String connectionId, String discussionId) {
        removeField(connectionDiscussions, connectionId, discussionId);
    }

    @Override
    public long countConnections(Instant now) {
        return connections.asMap().values().stream()
                .filter(record -> !record.isExpiredAt(now))
                .count();
    }

    @Override
    public int purgeExpired(Instant now) {
        int removed = 0;
        for (ConnectionRecord record : connections.asMap().values()) {
            if (record.isExpiredAt(now) && connections.asMap().remove(record.getConnectionId(), record)) {
                removed++;
            }
        }
        removed += purgeFields(discussionSubscribers, s -> s.isExpiredAt(now));
        removed += purgeFields(connectionDiscussions, s -> s.isExpiredAt(now));
        removed += purgeFields(userLinks, l -> l.isExpiredAt(now));
        if (removed > 0) {
            log.debug("Purged {} expired presence records from memory", removed);
        }
        return removed;
    }

    private static <V> void putField(Cache<String, Map<String, V>> cache, String key, String field, V value) {
        cache.asMap().compute(key, (k, fields) -> {
            Map<String, V> updated = fields != null ? fields : new ConcurrentHashMap<>();
            updated.put(field, value);
            return updated;
        });
    }

    private static <V> void removeField(Cache<String, Map<String, V>> cache, String key, String field) {
        cache.asMap().computeIfPresent(key, (k, fields) -> {
            fields.remove(field);
            return fields.isEmpty() ? null : fields;
        });
    }

    private static <V> int purgeFields(Cache<String, Map<String, V>> cache, Predicate<V> expired) {
        int[] removed = {0};
        for (String key : Set.copyOf(cache.asMap().keySet())) {
            cache.asMap().computeIfPresent(key, (k, fields) -> {
                int before = fields.size();
                fields.values().removeIf(expired);
                removed[0] += before - fields.size();
                return fields.isEmpty() ? null : fields;
            });
        }
        return removed[0];
    }

    private static <V> Map<String, V> copyOf(Map<String, V> fields) {
        return fields != null ? Map.copyOf(fields) : Map.of();
    }
}
