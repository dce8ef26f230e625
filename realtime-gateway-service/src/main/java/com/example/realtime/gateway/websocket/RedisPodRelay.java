package com.example.realtime.gateway.websocket;

import com.example.realtime.gateway.dto.RelayedDelivery;
import com.example.realtime.shared.config.AppProperties;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.data.redis.core.StringRedisTemplate;
import org.springframework.stereotype.Component;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Scheduler;

/**
 * Publishes relayed frames on the owning pod's Redis channel, {@code {prefix}relay:{podId}}.
 */
@Component
@Slf4j
@RequiredArgsConstructor
@ConditionalOnProperty(name = "realtime.presence.store", havingValue = "redis", matchIfMissing = true)
public class RedisPodRelay implements PodRelay {

    private final StringRedisTemplate redisTemplate;
    private final ObjectMapper objectMapper;
    private final AppProperties appProperties;
    @Qualifier("presenceScheduler")
    private final Scheduler presenceScheduler;

    public static String channelFor(String keyPrefix, String podId) {
        return keyPrefix + "relay:" + podId;
    }

    @Override
    public Mono<Boolean> relay(String podId, RelayedDelivery delivery) {
        return Mono.fromCallable(() -> {
                    String channel = channelFor(appProperties.getPresence().getKeyPrefix(), podId);
                    Long receivers = redisTemplate.convertAndSend(channel, objectMapper.writeValueAsString(delivery));
                    log.debug("Relayed frame for connection {} to {} ({} receiver(s))",
                            delivery.getConnectionId(), channel, receivers);
                    return receivers != null && receivers > 0;
                })
                .subscribeOn(presenceScheduler);
    }
}
