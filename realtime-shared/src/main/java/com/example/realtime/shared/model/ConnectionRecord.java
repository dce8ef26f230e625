package com.example.realtime.shared.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;
import lombok.With;

import java.time.Instant;

/**
 * One live transport session. A missing or expired record means the session is gone.
 * {@code podId} names the gateway instance holding the socket.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@With
public class ConnectionRecord {
    private String connectionId;
    private String userId;
    private String podId;
    private Instant connectedAt;
    private Instant lastActivityAt;
    private Instant expiresAt;

    public boolean isExpiredAt(Instant now) {
        return expiresAt != null && !expiresAt.isAfter(now);
    }
}
