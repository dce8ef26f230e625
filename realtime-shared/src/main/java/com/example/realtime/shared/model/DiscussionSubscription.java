package com.example.realtime.shared.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;

/**
 * "This connection listens to this discussion". The same value is stored under the discussion key and
 * under the connection key.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class DiscussionSubscription {
    private String discussionId;
    private String connectionId;
    private String userId;
    private Instant joinedAt;
    private Instant expiresAt;

    public boolean isExpiredAt(Instant now) {
        return expiresAt != null && !expiresAt.isAfter(now);
    }
}
