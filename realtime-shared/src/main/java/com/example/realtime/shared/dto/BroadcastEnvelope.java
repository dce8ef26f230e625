package com.example.realtime.shared.dto;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Getter;
import lombok.ToString;

import java.time.Instant;

/**
 * The unit of fan-out. Serialized as {@code {action, data, timestamp, userId?}}; the origin connection and
 * topic stay server-side.
 */
@Getter
@Builder(toBuilder = true)
@ToString
@AllArgsConstructor
@JsonInclude(JsonInclude.Include.NON_NULL)
@JsonPropertyOrder({"action", "data", "timestamp", "userId"})
public class BroadcastEnvelope {

    private final String action;
    private final Object data;
    /**
     * ISO-8601 instant.
     */
    private final String timestamp;
    private final String userId;

    @JsonIgnore
    private final String originConnectionId;
    @JsonIgnore
    private final String topicId;

    public static BroadcastEnvelope of(String action, Object data, Instant timestamp) {
        return BroadcastEnvelope.builder()
                .action(action)
                .data(data)
                .timestamp(timestamp.toString())
                .build();
    }
}
