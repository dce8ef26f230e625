package com.example.realtime.shared.dto;

import com.example.realtime.shared.util.Constants.DomainEventType;
import lombok.Builder;
import lombok.Getter;
import lombok.ToString;

import java.time.Instant;
import java.util.Map;

/**
 * A post change reconstructed from the record store. {@code timestamp} is the governing time: creation
 * for created posts, last update for everything else.
 */
@Getter
@Builder
@ToString
public class DomainEvent {

    private final DomainEventType type;
    private final String discussionId;
    private final String postId;
    private final Instant timestamp;
    private final String userId;
    private final Map<String, Object> data;

    public BroadcastEnvelope toEnvelope() {
        return BroadcastEnvelope.builder()
                .action(type.getAction())
                .data(data)
                .timestamp(timestamp.toString())
                .userId(userId)
                .topicId(discussionId)
                .build();
    }
}
