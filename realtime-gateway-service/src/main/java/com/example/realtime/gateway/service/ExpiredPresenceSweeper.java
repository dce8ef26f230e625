package com.example.realtime.gateway.service;

import com.example.realtime.shared.config.MonitoringConfig;
import com.example.realtime.shared.store.PresenceStore;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import net.javacrumbs.shedlock.spring.annotation.SchedulerLock;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Service;

import java.time.Clock;

/**
 * Physically removes presence records past their expiry. Reads already ignore them; this only keeps the
 * store from growing. One pod sweeps at a time.
 */
@Service
@Slf4j
@RequiredArgsConstructor
public class ExpiredPresenceSweeper {

    private final PresenceStore presenceStore;
    private final Clock clock;
    private final MonitoringConfig.RealtimeMetricsCollector metricsCollector;

    @Scheduled(fixedDelayString = "${realtime.sweep.interval:PT5M}", initialDelayString = "${realtime.sweep.interval:PT5M}")
    @SchedulerLock(name = "sweepExpiredPresence", lockAtLeastFor = "PT30S", lockAtMostFor = "PT4M")
    public void sweepExpired() {
        try {
            int removed = presenceStore.purgeExpired(clock.instant());
            if (removed > 0) {
                metricsCollector.incrementCounter("realtime.presence.purged", removed);
                log.info("Purged {} expired presence record(s)", removed);
            } else {
                log.debug("No expired presence records to purge");
            }
        } catch (RuntimeException e) {
            log.error("Expired presence sweep failed: {}", e.getMessage(), e);
        }
    }
}
