package com.example.realtime.gateway.support;

import com.example.realtime.gateway.service.BroadcastDispatcher;
import com.example.realtime.gateway.service.ConnectionRegistry;
import com.example.realtime.gateway.service.StaleConnectionReaper;
import com.example.realtime.gateway.service.SubscriptionIndex;
import com.example.realtime.shared.config.AppProperties;
import com.example.realtime.shared.config.MonitoringConfig;
import com.example.realtime.shared.store.CaffeinePresenceStore;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import reactor.core.scheduler.Schedulers;

import java.time.Duration;
import java.time.Instant;

/**
 * Wires the presence components over an in-memory store, a controllable clock and a recording transport.
 */
public class PresenceFixture {

    public static final Instant START = Instant.parse("2024-05-01T10:00:00Z");

    public final MutableClock clock = new MutableClock(START);
    public final AppProperties appProperties = new AppProperties();
    public final CaffeinePresenceStore store = new CaffeinePresenceStore(Duration.ofDays(2), 10_000);
    public final MonitoringConfig.RealtimeMetricsCollector metrics =
            new MonitoringConfig.RealtimeMetricsCollector(new SimpleMeterRegistry());
    public final RecordingPushTransport transport = new RecordingPushTransport();
    public final ObjectMapper objectMapper = new ObjectMapper();

    public final ConnectionRegistry registry =
            new ConnectionRegistry(store, appProperties, clock, Schedulers.immediate());
    public final SubscriptionIndex index =
            new SubscriptionIndex(store, appProperties, clock, Schedulers.immediate());
    public final StaleConnectionReaper reaper = new StaleConnectionReaper(registry, index, metrics);
    public final BroadcastDispatcher dispatcher = new BroadcastDispatcher(
            index, registry, reaper, transport, objectMapper, appProperties, metrics);

    public void connect(String connectionId, String userId) {
        registry.open(connectionId, userId).block();
    }

    public void join(String discussionId, String connectionId) {
        index.join(discussionId, connectionId, null).block();
    }
}
