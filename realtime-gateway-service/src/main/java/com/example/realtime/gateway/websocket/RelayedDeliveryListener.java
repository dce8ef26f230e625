package com.example.realtime.gateway.websocket;

import com.example.realtime.gateway.dto.RelayedDelivery;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.data.redis.connection.Message;
import org.springframework.data.redis.connection.MessageListener;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.nio.charset.StandardCharsets;

/**
 * Receives frames other pods relayed on this pod's channel.
 */
@Component
@Slf4j
@RequiredArgsConstructor
@ConditionalOnProperty(name = "realtime.presence.store", havingValue = "redis", matchIfMissing = true)
public class RelayedDeliveryListener implements MessageListener {

    private final ObjectMapper objectMapper;
    private final RelayedDeliveryHandler relayedDeliveryHandler;

    @Override
    public void onMessage(Message message, byte[] pattern) {
        RelayedDelivery delivery;
        try {
            delivery = objectMapper.readValue(message.getBody(), RelayedDelivery.class);
        } catch (IOException e) {
            log.error("Failed to deserialize relayed frame. Raw message: {}",
                    new String(message.getBody(), StandardCharsets.UTF_8), e);
            return;
        }
        relayedDeliveryHandler.deliver(delivery)
                .subscribe(null, e -> log.error("Relayed frame for connection {} failed: {}",
                        delivery.getConnectionId(), e.getMessage(), e));
    }
}
