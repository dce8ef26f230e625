package com.example.realtime.gateway.service;

import com.example.realtime.gateway.support.PresenceFixture;
import com.example.realtime.shared.store.PresenceStore;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Clock;
import java.time.Duration;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatCode;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;

@DisplayName("ExpiredPresenceSweeper Tests")
class ExpiredPresenceSweeperTest {

    @Test
    @DisplayName("Sweeping purges expired connections and subscriptions only")
    void sweepPurgesExpired() {
        // Given
        PresenceFixture fixture = new PresenceFixture();
        fixture.connect("old", "u1");
        fixture.join("d1", "old");
        fixture.clock.advance(Duration.ofHours(23));
        fixture.connect("fresh", "u2");
        fixture.join("d1", "fresh");
        fixture.clock.advance(Duration.ofHours(2));
        ExpiredPresenceSweeper sweeper = new ExpiredPresenceSweeper(fixture.store, fixture.clock, fixture.metrics);

        // When
        sweeper.sweepExpired();

        // Then
        assertThat(fixture.store.findConnection("old")).isEmpty();
        assertThat(fixture.store.findConnection("fresh")).isPresent();
        assertThat(fixture.store.findTopicSubscribers("d1")).containsOnlyKeys("fresh");
        assertThat(fixture.metrics.getCounterValue("realtime.presence.purged")).isPositive();
    }

    @Test
    @DisplayName("Store failures do not escape the scheduled run")
    void storeFailureIsContained() {
        PresenceStore store = mock(PresenceStore.class);
        when(store.purgeExpired(any())).thenThrow(new IllegalStateException("redis down"));
        ExpiredPresenceSweeper sweeper = new ExpiredPresenceSweeper(store, Clock.systemUTC(),
                new PresenceFixture().metrics);

        assertThatCode(sweeper::sweepExpired).doesNotThrowAnyException();
    }
}
