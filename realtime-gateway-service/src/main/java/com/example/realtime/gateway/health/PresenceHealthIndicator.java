package com.example.realtime.gateway.health;

import com.example.realtime.gateway.websocket.WebSocketSessionManager;
import com.example.realtime.shared.config.AppProperties;
import com.example.realtime.shared.store.PresenceStore;
import org.springframework.boot.actuate.health.Health;
import org.springframework.boot.actuate.health.HealthIndicator;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.util.HashMap;
import java.util.Map;

/**
 * Reports the presence store as DOWN when it cannot be read, along with the local session count.
 */
@Component
public class PresenceHealthIndicator implements HealthIndicator {

    private final PresenceStore presenceStore;
    private final WebSocketSessionManager sessionManager;
    private final AppProperties appProperties;
    private final Clock clock;

    public PresenceHealthIndicator(PresenceStore presenceStore,
                                   WebSocketSessionManager sessionManager,
                                   AppProperties appProperties,
                                   Clock clock) {
        this.presenceStore = presenceStore;
        this.sessionManager = sessionManager;
        this.appProperties = appProperties;
        this.clock = clock;
    }

    @Override
    public Health health() {
        Map<String, Object> details = new HashMap<>();
        details.put("store", appProperties.getPresence().getStore().name().toLowerCase());
        details.put("localSessions", sessionManager.getActiveConnectionCount());

        boolean storeHealthy = checkStore(details);

        return (storeHealthy ? Health.up() : Health.down())
                .withDetails(details)
                .build();
    }

    private boolean checkStore(Map<String, Object> details) {
        try {
            details.put("liveConnections", presenceStore.countConnections(clock.instant()));
            details.put("storeStatus", "UP");
            return true;
        } catch (RuntimeException e) {
            details.put("storeStatus", "DOWN");
            details.put("storeError", e.getMessage());
            return false;
        }
    }
}
