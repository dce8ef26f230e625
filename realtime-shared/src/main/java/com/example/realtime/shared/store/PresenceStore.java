package com.example.realtime.shared.store;

import com.example.realtime.shared.model.ConnectionRecord;
import com.example.realtime.shared.model.DiscussionSubscription;
import com.example.realtime.shared.model.UserConnectionLink;

import java.time.Duration;
import java.time.Instant;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Keyed storage for connections, user links and both directions of discussion subscriptions.
 * <p>
 * Every record is independently keyed; there are no multi-key transactions. Reads may return records whose
 * {@code expiresAt} has already passed, callers filter them. Implementations throw on infrastructure
 * failure and leave the best-effort policy to their callers.
 */
public interface PresenceStore {

    void saveConnection(ConnectionRecord record, Duration ttl);

    Optional<ConnectionRecord> findConnection(String connectionId);

    void deleteConnection(String connectionId);

    void saveUserLink(UserConnectionLink link, Duration ttl);

    /**
     * @return links of the user keyed by connection id
     */
    Map<String, UserConnectionLink> findUserLinks(String userId);

    /**
     * Reverse lookup used when reaping: which users hold a link to this connection.
     */
    Set<String> findLinkedUsers(String connectionId);

    void deleteUserLink(String userId, String connectionId);

    void saveTopicSubscriber(DiscussionSubscription subscription, Duration ttl);

    void saveConnectionTopic(DiscussionSubscription subscription, Duration ttl);

    /**
     * @return subscriptions of the discussion keyed by connection id
     */
    Map<String, DiscussionSubscription> findTopicSubscribers(String discussionId);

    /**
     * @return subscriptions of the connection keyed by discussion id
     */
    Map<String, DiscussionSubscription> findConnectionTopics(String connectionId);

    void deleteTopicSubscriber(String discussionId, String connectionId);

    void deleteConnectionTopic(String connectionId, String discussionId);

    /**
     * Number of connection records that have not expired at {@code now}.
     */
    long countConnections(Instant now);

    /**
     * Physically removes records that expired before {@code now}.
     *
     * @return number of records removed
     */
    int purgeExpired(Instant now);
}
