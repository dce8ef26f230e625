package com.example.realtime.gateway.config;

import com.example.realtime.gateway.websocket.RedisPodRelay;
import com.example.realtime.gateway.websocket.RelayedDeliveryListener;
import com.example.realtime.shared.config.AppProperties;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.data.redis.connection.RedisConnectionFactory;
import org.springframework.data.redis.listener.ChannelTopic;
import org.springframework.data.redis.listener.RedisMessageListenerContainer;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

import java.util.concurrent.Executor;

/**
 * Subscribes this pod to its own relay channel.
 */
@Configuration
@Slf4j
@ConditionalOnProperty(name = "realtime.presence.store", havingValue = "redis", matchIfMissing = true)
public class PodRelayConfig {

    @Bean
    public RedisMessageListenerContainer relayListenerContainer(RedisConnectionFactory connectionFactory,
                                                                Executor relayListenerExecutor,
                                                                RelayedDeliveryListener relayedDeliveryListener,
                                                                AppProperties appProperties) {
        RedisMessageListenerContainer container = new RedisMessageListenerContainer();
        container.setConnectionFactory(connectionFactory);
        container.setTaskExecutor(relayListenerExecutor);
        String channel = RedisPodRelay.channelFor(appProperties.getPresence().getKeyPrefix(), appProperties.getPodName());
        container.addMessageListener(relayedDeliveryListener, new ChannelTopic(channel));
        log.info("Listening for relayed frames on {}", channel);
        return container;
    }

    @Bean
    public Executor relayListenerExecutor() {
        ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
        executor.setCorePoolSize(4);
        executor.setMaxPoolSize(16);
        executor.setQueueCapacity(1000);
        executor.setThreadNamePrefix("relay-listener-");
        executor.initialize();
        return executor;
    }
}
