package com.example.realtime.shared.store;

import com.example.realtime.shared.aspect.Monitored;
import com.example.realtime.shared.config.AppProperties;
import com.example.realtime.shared.model.ConnectionRecord;
import com.example.realtime.shared.model.DiscussionSubscription;
import com.example.realtime.shared.model.UserConnectionLink;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.data.redis.core.Cursor;
import org.springframework.data.redis.core.HashOperations;
import org.springframework.data.redis.core.ScanOptions;
import org.springframework.data.redis.core.StringRedisTemplate;
import org.springframework.stereotype.Service;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.function.Predicate;

/**
 * Redis layout:
 * <pre>
 * {prefix}conn:{connectionId}              STRING  ConnectionRecord JSON, EX ttl
 * {prefix}connections-by-expiry            ZSET    connectionId scored by expiry epoch second
 * {prefix}user-conn:{userId}               HASH    connectionId -> UserConnectionLink JSON
 * {prefix}conn-user:{connectionId}         SET     userIds linked to the connection
 * {prefix}discussion-conn:{discussionId}   HASH    connectionId -> DiscussionSubscription JSON
 * {prefix}conn-discussion:{connectionId}   HASH    discussionId -> DiscussionSubscription JSON
 * </pre>
 * Hash keys get their EXPIRE refreshed on every write, so a hash disappears once its newest member expires;
 * older members are filtered on read and purged by the sweeper.
 */
@Service
@Slf4j
@Monitored("store")
@ConditionalOnProperty(name = "realtime.presence.store", havingValue = "redis", matchIfMissing = true)
public class RedisPresenceStore implements PresenceStore {

    private static final String CONNECTION_KEY = "conn:";
    private static final String CONNECTIONS_BY_EXPIRY_KEY = "connections-by-expiry";
    private static final String USER_CONNECTIONS_KEY = "user-conn:";
    private static final String CONNECTION_USERS_KEY = "conn-user:";
    private static final String DISCUSSION_CONNECTIONS_KEY = "discussion-conn:";
    private static final String CONNECTION_DISCUSSIONS_KEY = "conn-discussion:";

    private final StringRedisTemplate redisTemplate;
    private final ObjectMapper objectMapper;
    private final String prefix;

    public RedisPresenceStore(StringRedisTemplate redisTemplate, ObjectMapper objectMapper, AppProperties appProperties) {
        this.redisTemplate = redisTemplate;
        this.objectMapper = objectMapper;
        this.prefix = appProperties.getPresence().getKeyPrefix();
    }

    @Override
    public void saveConnection(ConnectionRecord record, Duration ttl) {
        redisTemplate.opsForValue().set(key(CONNECTION_KEY, record.getConnectionId()), toJson(record), ttl);
        redisTemplate.opsForZSet().add(prefix + CONNECTIONS_BY_EXPIRY_KEY, record.getConnectionId(), record.getExpiresAt().getEpochSecond());
        log.debug("Connection saved in Redis: connectionId={}, userId={}", record.getConnectionId(), record.getUserId());
    }

    @Override
    public Optional<ConnectionRecord> findConnection(String connectionId) {
        String json = redisTemplate.opsForValue().get(key(CONNECTION_KEY, connectionId));
        return Optional.ofNullable(fromJson(json, ConnectionRecord.class));
    }

    @Override
    public void deleteConnection(String connectionId) {
        redisTemplate.delete(key(CONNECTION_KEY, connectionId));
        redisTemplate.opsForZSet().remove(prefix + CONNECTIONS_BY_EXPIRY_KEY, connectionId);
    }

    @Override
    public void saveUserLink(UserConnectionLink link, Duration ttl) {
        String userKey = key(USER_CONNECTIONS_KEY, link.getUserId());
        String reverseKey = key(CONNECTION_USERS_KEY, link.getConnectionId());
        redisTemplate.opsForHash().put(userKey, link.getConnectionId(), toJson(link));
        redisTemplate.expire(userKey, ttl);
        redisTemplate.opsForSet().add(reverseKey, link.getUserId());
        redisTemplate.expire(reverseKey, ttl);
    }

    @Override
    public Map<String, UserConnectionLink> findUserLinks(String userId) {
        return readHash(key(USER_CONNECTIONS_KEY, userId), UserConnectionLink.class);
    }

    @Override
    public Set<String> findLinkedUsers(String connectionId) {
        Set<String> members = redisTemplate.opsForSet().members(key(CONNECTION_USERS_KEY, connectionId));
        return members != null ? members : Collections.emptySet();
    }

    @Override
    public void deleteUserLink(String userId, String connectionId) {
        redisTemplate.opsForHash().delete(key(USER_CONNECTIONS_KEY, userId), connectionId);
        redisTemplate.opsForSet().remove(key(CONNECTION_USERS_KEY, connectionId), userId);
    }

    @Override
    public void saveTopicSubscriber(DiscussionSubscription subscription, Duration ttl) {
        String discussionKey = key(DISCUSSION_CONNECTIONS_KEY, subscription.getDiscussionId());
        redisTemplate.opsForHash().put(discussionKey, subscription.getConnectionId(), toJson(subscription));
        redisTemplate.expire(discussionKey, ttl);
    }

    @Override
    public void saveConnectionTopic(DiscussionSubscription subscription, Duration ttl) {
        String connectionKey = key(CONNECTION_DISCUSSIONS_KEY, subscription.getConnectionId());
        redisTemplate.opsForHash().put(connectionKey, subscription.getDiscussionId(), toJson(subscription));
        redisTemplate.expire(connectionKey, ttl);
    }

    @Override
    public Map<String, DiscussionSubscription> findTopicSubscribers(String discussionId) {
        return readHash(key(DISCUSSION_CONNECTIONS_KEY, discussionId), DiscussionSubscription.class);
    }

    @Override
    public Map<String, DiscussionSubscription> findConnectionTopics(String connectionId) {
        return readHash(key(CONNECTION_DISCUSSIONS_KEY, connectionId), DiscussionSubscription.class);
    }

    @Override
    public void deleteTopicSubscriber(String discussionId, String connectionId) {
        redisTemplate.opsForHash().delete(key(DISCUSSION_CONNECTIONS_KEY, discussionId), connectionId);
    }

    @Override
    public void deleteConnectionTopic(String connectionId, String discussionId) {
        redisTemplate.opsForHash().delete(key(CONNECTION_DISCUSSIONS_KEY, connectionId), discussionId);
    }

    @Override
    public long countConnections(Instant now) {
        Long count = redisTemplate.opsForZSet().count(prefix + CONNECTIONS_BY_EXPIRY_KEY, now.getEpochSecond() + 1, Double.POSITIVE_INFINITY);
        return count != null ? count : 0;
    }

    @Override
    public int purgeExpired(Instant now) {
        int removed = 0;
        Long expiredConnections = redisTemplate.opsForZSet().removeRangeByScore(prefix + CONNECTIONS_BY_EXPIRY_KEY, 0, now.getEpochSecond());
        if (expiredConnections != null) {
            removed += expiredConnections.intValue();
        }
        removed += purgeExpiredHashFields(DISCUSSION_CONNECTIONS_KEY, DiscussionSubscription.class, s -> s.isExpiredAt(now));
        removed += purgeExpiredHashFields(CONNECTION_DISCUSSIONS_KEY, DiscussionSubscription.class, s -> s.isExpiredAt(now));
        removed += purgeExpiredHashFields(USER_CONNECTIONS_KEY, UserConnectionLink.class, l -> l.isExpiredAt(now));
        return removed;
    }

    private <T> int purgeExpiredHashFields(String keyType, Class<T> type, Predicate<T> expired) {
        int removed = 0;
        HashOperations<String, String, String> hashOps = redisTemplate.opsForHash();
        for (String hashKey : scanKeys(prefix + keyType + "*")) {
            List<String> expiredFields = new ArrayList<>();
            hashOps.entries(hashKey).forEach((field, json) -> {
                T value = fromJson(json, type);
                if (value == null || expired.test(value)) {
                    expiredFields.add(field);
                }
            });
            if (!expiredFields.isEmpty()) {
                hashOps.delete(hashKey, expiredFields.toArray());
                removed += expiredFields.size();
            }
        }
        return removed;
    }

    private List<String> scanKeys(String pattern) {
        List<String> keys = new ArrayList<>();
        try (Cursor<String> cursor = redisTemplate.scan(ScanOptions.scanOptions().match(pattern).count(1000).build())) {
            while (cursor.hasNext()) {
                keys.add(cursor.next());
            }
        }
        return keys;
    }

    private <T> Map<String, T> readHash(String hashKey, Class<T> type) {
        HashOperations<String, String, String> hashOps = redisTemplate.opsForHash();
        Map<String, String> entries = hashOps.entries(hashKey);
        Map<String, T> result = new LinkedHashMap<>();
        entries.forEach((field, json) -> {
            T value = fromJson(json, type);
            if (value != null) {
                result.put(field, value);
            }
        });
        return result;
    }

    private String key(String type, String id) {
        return prefix + type + id;
    }

    private String toJson(Object value) {
        try {
            return objectMapper.writeValueAsString(value);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Failed to serialize " + value.getClass().getSimpleName(), e);
        }
    }

    private <T> T fromJson(String json, Class<T> type) {
        if (json == null) {
            return null;
        }
        try {
            return objectMapper.readValue(json, type);
        } catch (JsonProcessingException e) {
            log.error("Failed to deserialize {} from Redis: {}", type.getSimpleName(), e.getMessage());
            return null;
        }
    }
}
