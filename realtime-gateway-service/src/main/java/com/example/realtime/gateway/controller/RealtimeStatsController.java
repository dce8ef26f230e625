package com.example.realtime.gateway.controller;

import com.example.realtime.gateway.service.ConnectionRegistry;
import com.example.realtime.gateway.service.SubscriptionIndex;
import com.example.realtime.gateway.websocket.WebSocketSessionManager;
import com.example.realtime.shared.config.AppProperties;
import lombok.RequiredArgsConstructor;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;
import reactor.core.publisher.Mono;

import java.time.Clock;
import java.util.LinkedHashMap;
import java.util.Map;

@RestController
@RequestMapping("/api/realtime")
@RequiredArgsConstructor
public class RealtimeStatsController {

    private final ConnectionRegistry connectionRegistry;
    private final SubscriptionIndex subscriptionIndex;
    private final WebSocketSessionManager sessionManager;
    private final AppProperties appProperties;
    private final Clock clock;

    @GetMapping("/stats")
    public Mono<Map<String, Object>> getStats() {
        return connectionRegistry.countLiveConnections()
                .map(liveConnections -> {
                    Map<String, Object> stats = new LinkedHashMap<>();
                    stats.put("liveConnections", liveConnections);
                    stats.put("podConnections", sessionManager.getActiveConnectionCount());
                    stats.put("podId", appProperties.getPodName());
                    stats.put("timestamp", clock.instant().toString());
                    return stats;
                });
    }

    @GetMapping("/discussions/{discussionId}/subscribers")
    public Mono<Map<String, Object>> getSubscribers(@PathVariable String discussionId) {
        return subscriptionIndex.subscribersOf(discussionId)
                .map(subscribers -> {
                    Map<String, Object> body = new LinkedHashMap<>();
                    body.put("discussionId", discussionId);
                    body.put("subscriberCount", subscribers.size());
                    return body;
                });
    }
}
