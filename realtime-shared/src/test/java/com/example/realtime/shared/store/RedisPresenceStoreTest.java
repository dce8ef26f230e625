package com.example.realtime.shared.store;

import com.example.realtime.shared.config.AppProperties;
import com.example.realtime.shared.model.ConnectionRecord;
import com.example.realtime.shared.model.DiscussionSubscription;
import com.example.realtime.shared.model.UserConnectionLink;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.data.redis.core.Cursor;
import org.springframework.data.redis.core.HashOperations;
import org.springframework.data.redis.core.ScanOptions;
import org.springframework.data.redis.core.SetOperations;
import org.springframework.data.redis.core.StringRedisTemplate;
import org.springframework.data.redis.core.ValueOperations;
import org.springframework.data.redis.core.ZSetOperations;

import java.time.Duration;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyDouble;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.lenient;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
@DisplayName("RedisPresenceStore Tests")
class RedisPresenceStoreTest {

    private static final Duration TTL = Duration.ofHours(1);
    private static final Instant NOW = Instant.parse("2024-05-01T10:00:00Z");
    private static final String EXPIRY_INDEX = "rt:connections-by-expiry";

    @Mock
    private StringRedisTemplate redisTemplate;
    @Mock
    private ValueOperations<String, String> valueOps;
    @Mock
    private ZSetOperations<String, String> zSetOps;
    @Mock
    private HashOperations<String, Object, Object> hashOps;
    @Mock
    private SetOperations<String, String> setOps;

    private final ObjectMapper objectMapper = new ObjectMapper().registerModule(new JavaTimeModule());
    private RedisPresenceStore store;

    @BeforeEach
    void setUp() {
        lenient().when(redisTemplate.opsForValue()).thenReturn(valueOps);
        lenient().when(redisTemplate.opsForZSet()).thenReturn(zSetOps);
        lenient().when(redisTemplate.opsForHash()).thenReturn(hashOps);
        lenient().when(redisTemplate.opsForSet()).thenReturn(setOps);

        AppProperties appProperties = new AppProperties();
        appProperties.getPresence().setKeyPrefix("rt:");
        store = new RedisPresenceStore(redisTemplate, objectMapper, appProperties);
    }

    @Test
    @DisplayName("saveConnection() writes the JSON record with its TTL and indexes it by expiry second")
    void saveConnectionWritesValueAndExpiryIndex() throws Exception {
        // Given
        ConnectionRecord record = connection("c1", NOW.plus(TTL));

        // When
        store.saveConnection(record, TTL);

        // Then
        ArgumentCaptor<String> json = ArgumentCaptor.forClass(String.class);
        verify(valueOps).set(eq("rt:conn:c1"), json.capture(), eq(TTL));
        assertThat(objectMapper.readValue(json.getValue(), ConnectionRecord.class)).isEqualTo(record);
        verify(zSetOps).add(EXPIRY_INDEX, "c1", (double) NOW.plus(TTL).getEpochSecond());
    }

    @Test
    @DisplayName("findConnection() reads missing and unreadable values as absent")
    void findConnectionToleratesMissingAndBrokenValues() throws Exception {
        // Given
        when(valueOps.get("rt:conn:c1")).thenReturn(objectMapper.writeValueAsString(connection("c1", NOW.plus(TTL))));
        when(valueOps.get("rt:conn:broken")).thenReturn("{not json");
        when(valueOps.get("rt:conn:missing")).thenReturn(null);

        // When & Then
        assertThat(store.findConnection("c1")).get().extracting(ConnectionRecord::getPodId).isEqualTo("pod-a");
        assertThat(store.findConnection("broken")).isEmpty();
        assertThat(store.findConnection("missing")).isEmpty();
    }

    @Test
    @DisplayName("deleteConnection() removes the value and the expiry index entry")
    void deleteConnectionRemovesBoth() {
        store.deleteConnection("c1");

        verify(redisTemplate).delete("rt:conn:c1");
        verify(zSetOps).remove(EXPIRY_INDEX, "c1");
    }

    @Test
    @DisplayName("saveUserLink() writes both directions and refreshes the EXPIRE of each key")
    void saveUserLinkWritesBothDirections() {
        // When
        store.saveUserLink(UserConnectionLink.builder()
                .userId("u1").connectionId("c1").connectedAt(NOW).expiresAt(NOW.plus(TTL)).build(), TTL);

        // Then
        verify(hashOps).put(eq("rt:user-conn:u1"), eq("c1"), anyString());
        verify(redisTemplate).expire("rt:user-conn:u1", TTL);
        verify(setOps).add("rt:conn-user:c1", "u1");
        verify(redisTemplate).expire("rt:conn-user:c1", TTL);
    }

    @Test
    @DisplayName("Subscriptions are keyed by discussion and by connection")
    void subscriptionKeys() {
        // Given
        DiscussionSubscription subscription = subscription("d1", "c1", NOW.plus(TTL));

        // When
        store.saveTopicSubscriber(subscription, TTL);
        store.saveConnectionTopic(subscription, TTL);

        // Then
        verify(hashOps).put(eq("rt:discussion-conn:d1"), eq("c1"), anyString());
        verify(redisTemplate).expire("rt:discussion-conn:d1", TTL);
        verify(hashOps).put(eq("rt:conn-discussion:c1"), eq("d1"), anyString());
        verify(redisTemplate).expire("rt:conn-discussion:c1", TTL);
    }

    @Test
    @DisplayName("findTopicSubscribers() skips fields that cannot be parsed")
    void findTopicSubscribersSkipsUnreadableFields() throws Exception {
        // Given
        Map<Object, Object> fields = new LinkedHashMap<>();
        fields.put("c1", objectMapper.writeValueAsString(subscription("d1", "c1", NOW.plus(TTL))));
        fields.put("c2", "not-json");
        when(hashOps.entries("rt:discussion-conn:d1")).thenReturn(fields);

        // When
        Map<String, DiscussionSubscription> subscribers = store.findTopicSubscribers("d1");

        // Then
        assertThat(subscribers).containsOnlyKeys("c1");
        assertThat(subscribers.get("c1").getDiscussionId()).isEqualTo("d1");
    }

    @Test
    @DisplayName("countConnections() counts scores strictly after now, so a record expiring now is not live")
    void countConnectionsExcludesTheCurrentSecond() {
        // Given
        when(zSetOps.count(EXPIRY_INDEX, (double) (NOW.getEpochSecond() + 1), Double.POSITIVE_INFINITY))
                .thenReturn(3L);

        // When & Then
        assertThat(store.countConnections(NOW)).isEqualTo(3);
    }

    @Test
    @DisplayName("countConnections() reads a null reply as zero")
    void countConnectionsNullReply() {
        when(zSetOps.count(anyString(), anyDouble(), anyDouble())).thenReturn(null);

        assertThat(store.countConnections(NOW)).isZero();
    }

    @Test
    @DisplayName("purgeExpired() trims the expiry index and deletes expired or unreadable hash fields only")
    void purgeExpiredRemovesStaleFields() throws Exception {
        // Given
        when(zSetOps.removeRangeByScore(EXPIRY_INDEX, 0, (double) NOW.getEpochSecond())).thenReturn(2L);

        Cursor<String> discussionKeys = cursorOver("rt:discussion-conn:d1");
        @SuppressWarnings("unchecked")
        Cursor<String> noKeys = mock(Cursor.class);
        when(redisTemplate.scan(any(ScanOptions.class))).thenAnswer(invocation -> {
            ScanOptions options = invocation.getArgument(0);
            return "rt:discussion-conn:*".equals(options.getPattern()) ? discussionKeys : noKeys;
        });

        Map<Object, Object> fields = new LinkedHashMap<>();
        fields.put("live", objectMapper.writeValueAsString(subscription("d1", "live", NOW.plusSeconds(1))));
        fields.put("old", objectMapper.writeValueAsString(subscription("d1", "old", NOW)));
        fields.put("bad", "not-json");
        when(hashOps.entries("rt:discussion-conn:d1")).thenReturn(fields);

        // When
        int removed = store.purgeExpired(NOW);

        // Then
        assertThat(removed).isEqualTo(4);
        verify(hashOps).delete("rt:discussion-conn:d1", "old", "bad");
    }

    private static Cursor<String> cursorOver(String key) {
        @SuppressWarnings("unchecked")
        Cursor<String> cursor = mock(Cursor.class);
        when(cursor.hasNext()).thenReturn(true, false);
        when(cursor.next()).thenReturn(key);
        return cursor;
    }

    private static ConnectionRecord connection(String connectionId, Instant expiresAt) {
        return ConnectionRecord.builder()
                .connectionId(connectionId)
                .userId("u1")
                .podId("pod-a")
                .connectedAt(NOW)
                .lastActivityAt(NOW)
                .expiresAt(expiresAt)
                .build();
    }

    private static DiscussionSubscription subscription(String discussionId, String connectionId, Instant expiresAt) {
        return DiscussionSubscription.builder()
                .discussionId(discussionId)
                .connectionId(connectionId)
                .joinedAt(NOW)
                .expiresAt(expiresAt)
                .build();
    }
}
