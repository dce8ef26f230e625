package com.example.realtime.gateway.websocket;

import com.example.realtime.gateway.dto.ControlMessage;
import com.example.realtime.gateway.service.BroadcastDispatcher;
import com.example.realtime.gateway.service.ConnectionRegistry;
import com.example.realtime.gateway.service.MissedMessageReconciler;
import com.example.realtime.gateway.service.SubscriptionIndex;
import com.example.realtime.gateway.service.UserDirectory;
import com.example.realtime.shared.config.MonitoringConfig;
import com.example.realtime.shared.dto.BroadcastEnvelope;
import com.example.realtime.shared.dto.DomainEvent;
import com.example.realtime.shared.model.ConnectionRecord;
import com.example.realtime.shared.util.Constants.Actions;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import reactor.core.publisher.Mono;

import java.time.Clock;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Handles one inbound text frame of a connection: refreshes its activity, then acts on the control message.
 * Actions that publish or read history are ignored for anonymous connections.
 */
@Component
@Slf4j
@RequiredArgsConstructor
public class ControlMessageRouter {

    static final String CONNECTION_NOT_FOUND = "Connection not found";
    static final String UNKNOWN_ACTION = "Unknown action";
    static final String PROCESSING_FAILED = "Failed to process message";
    static final String DISCUSSION_REQUIRED = "discussionId is required";

    private final ConnectionRegistry connectionRegistry;
    private final SubscriptionIndex subscriptionIndex;
    private final BroadcastDispatcher broadcastDispatcher;
    private final MissedMessageReconciler missedMessageReconciler;
    private final UserDirectory userDirectory;
    private final ObjectMapper objectMapper;
    private final Clock clock;
    private final MonitoringConfig.RealtimeMetricsCollector metricsCollector;

    public Mono<Void> route(String connectionId, String frame) {
        ControlMessage message;
        try {
            message = objectMapper.readValue(frame, ControlMessage.class);
        } catch (JsonProcessingException e) {
            log.warn("Malformed frame on connection {}: {}", connectionId, e.getOriginalMessage());
            return replyError(connectionId, PROCESSING_FAILED);
        }
        if (message == null || message.getAction() == null) {
            return replyError(connectionId, UNKNOWN_ACTION);
        }
        metricsCollector.incrementCounter("realtime.control.messages", "action", message.getAction());

        if (Actions.PING.equals(message.getAction())) {
            return reply(connectionId, BroadcastEnvelope.of(Actions.PONG, null, clock.instant()));
        }

        return connectionRegistry.touch(connectionId)
                .flatMap(connection -> dispatch(connection, message).thenReturn(Boolean.TRUE))
                .switchIfEmpty(Mono.defer(() -> {
                    log.warn("Frame from unregistered connection {}", connectionId);
                    return replyError(connectionId, CONNECTION_NOT_FOUND).thenReturn(Boolean.FALSE);
                }))
                .then()
                .onErrorResume(e -> {
                    log.error("Failed to handle {} on connection {}: {}", message.getAction(), connectionId, e.getMessage());
                    return replyError(connectionId, PROCESSING_FAILED);
                });
    }

    private Mono<Void> dispatch(ConnectionRecord connection, ControlMessage message) {
        String connectionId = connection.getConnectionId();
        String discussionId = message.getDiscussionId();

        switch (message.getAction()) {
            case Actions.JOIN_DISCUSSION:
                if (discussionId == null) {
                    return replyError(connectionId, DISCUSSION_REQUIRED);
                }
                return subscriptionIndex.join(discussionId, connectionId, connection.getUserId())
                        .then(reply(connectionId, BroadcastEnvelope.of(Actions.JOINED_DISCUSSION,
                                Map.of("discussionId", discussionId), clock.instant())));

            case Actions.LEAVE_DISCUSSION:
                if (discussionId == null) {
                    return replyError(connectionId, DISCUSSION_REQUIRED);
                }
                return subscriptionIndex.leave(discussionId, connectionId)
                        .then(reply(connectionId, BroadcastEnvelope.of(Actions.LEFT_DISCUSSION,
                                Map.of("discussionId", discussionId), clock.instant())));

            case Actions.BROADCAST_POST:
                if (!canPublish(connection, discussionId, message.getAction())) {
                    return Mono.empty();
                }
                Object type = message.dataValue("type");
                return broadcastDispatcher.broadcast(discussionId, BroadcastEnvelope.builder()
                                .action(type instanceof String s && !s.isBlank() ? s : Actions.NEW_POST)
                                .data(message.getData())
                                .userId(connection.getUserId())
                                .timestamp(clock.instant().toString())
                                .originConnectionId(connectionId)
                                .topicId(discussionId)
                                .build())
                        .then();

            case Actions.TYPING_START:
                if (!canPublish(connection, discussionId, message.getAction())) {
                    return Mono.empty();
                }
                return userDirectory.displayNameOf(connection.getUserId())
                        .flatMap(userName -> {
                            Map<String, Object> data = new LinkedHashMap<>();
                            data.put("userId", connection.getUserId());
                            data.put("userName", userName);
                            data.put("discussionId", discussionId);
                            return broadcastDispatcher.broadcast(discussionId,
                                    BroadcastEnvelope.of(Actions.TYPING_START, data, clock.instant()), connectionId);
                        })
                        .then();

            case Actions.TYPING_STOP:
                if (!canPublish(connection, discussionId, message.getAction())) {
                    return Mono.empty();
                }
                Map<String, Object> stopData = new LinkedHashMap<>();
                stopData.put("userId", connection.getUserId());
                stopData.put("discussionId", discussionId);
                return broadcastDispatcher.broadcast(discussionId,
                                BroadcastEnvelope.of(Actions.TYPING_STOP, stopData, clock.instant()), connectionId)
                        .then();

            case Actions.SYNC_REQUEST:
                if (!canPublish(connection, discussionId, message.getAction())) {
                    return Mono.empty();
                }
                Object watermark = message.dataValue("lastSyncTimestamp");
                return missedMessageReconciler.reconcile(discussionId, connection.getUserId(),
                                watermark != null ? watermark.toString() : null)
                        .flatMap(events -> reply(connectionId, BroadcastEnvelope.of(Actions.SYNC_RESPONSE,
                                Map.of("missedMessages", toEnvelopes(events)), clock.instant())));

            default:
                log.info("Unknown action '{}' on connection {}", message.getAction(), connectionId);
                return replyError(connectionId, UNKNOWN_ACTION);
        }
    }

    private boolean canPublish(ConnectionRecord connection, String discussionId, String action) {
        if (connection.getUserId() == null || discussionId == null) {
            log.debug("Ignoring {} on connection {}: anonymous or no discussion", action, connection.getConnectionId());
            return false;
        }
        return true;
    }

    private List<BroadcastEnvelope> toEnvelopes(List<DomainEvent> events) {
        return events.stream().map(DomainEvent::toEnvelope).toList();
    }

    private Mono<Void> reply(String connectionId, BroadcastEnvelope envelope) {
        return broadcastDispatcher.sendTo(connectionId, envelope);
    }

    private Mono<Void> replyError(String connectionId, String errorMessage) {
        return reply(connectionId, BroadcastEnvelope.of(Actions.ERROR, Map.of("message", errorMessage), clock.instant()));
    }
}
