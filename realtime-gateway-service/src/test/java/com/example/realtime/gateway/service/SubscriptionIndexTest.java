package com.example.realtime.gateway.service;

import com.example.realtime.gateway.support.PresenceFixture;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import reactor.test.StepVerifier;

import java.time.Duration;
import java.util.Set;

import static org.assertj.core.api.Assertions.assertThat;

@DisplayName("SubscriptionIndex Tests")
class SubscriptionIndexTest {

    private final PresenceFixture fixture = new PresenceFixture();
    private final SubscriptionIndex index = fixture.index;

    @Test
    @DisplayName("join() is visible from both directions")
    void joinWritesBothDirections() {
        // Given
        fixture.connect("c1", "u1");

        // When
        index.join("d1", "c1", "u1").block();

        // Then
        StepVerifier.create(index.subscribersOf("d1")).expectNext(Set.of("c1")).verifyComplete();
        StepVerifier.create(index.topicsOf("c1")).expectNext(Set.of("d1")).verifyComplete();
    }

    @Test
    @DisplayName("join() then leave() restores the previous subscriber set")
    void joinThenLeaveRestores() {
        // Given
        fixture.connect("c0", "u0");
        fixture.connect("c1", "u1");
        fixture.join("d1", "c0");
        Set<String> before = index.subscribersOf("d1").block();

        // When
        index.join("d1", "c1", null).block();
        index.leave("d1", "c1").block();

        // Then
        assertThat(index.subscribersOf("d1").block()).isEqualTo(before);
        assertThat(index.topicsOf("c1").block()).isEmpty();
    }

    @Test
    @DisplayName("Joining twice is an idempotent success")
    void rejoinIsIdempotent() {
        fixture.connect("c1", "u1");
        index.join("d1", "c1", null).block();
        StepVerifier.create(index.join("d1", "c1", null)).verifyComplete();

        assertThat(index.subscribersOf("d1").block()).containsExactly("c1");
    }

    @Test
    @DisplayName("Leaving a discussion that was never joined is a no-op")
    void leaveUnknownIsNoOp() {
        StepVerifier.create(index.leave("d1", "c1")).verifyComplete();
    }

    @Test
    @DisplayName("Expired subscriptions are not returned and get pruned")
    void expiredSubscriptionsArePruned() {
        // Given
        fixture.connect("c1", "u1");
        fixture.join("d1", "c1");
        fixture.clock.advance(Duration.ofHours(25));

        // When & Then
        assertThat(index.subscribersOf("d1").block()).isEmpty();
        assertThat(fixture.store.findTopicSubscribers("d1")).isEmpty();
        assertThat(fixture.store.findConnectionTopics("c1")).isEmpty();
    }

    @Test
    @DisplayName("leaveAll() removes every pair of the connection and reports the discussions")
    void leaveAllRemovesEveryPair() {
        // Given
        fixture.connect("c1", "u1");
        fixture.connect("c2", "u2");
        fixture.join("d1", "c1");
        fixture.join("d2", "c1");
        fixture.join("d1", "c2");

        // When & Then
        StepVerifier.create(index.leaveAll("c1")).expectNext(Set.of("d1", "d2")).verifyComplete();
        assertThat(index.subscribersOf("d1").block()).containsExactly("c2");
        assertThat(index.subscribersOf("d2").block()).isEmpty();
    }

    @Test
    @DisplayName("Subscribers whose connection record is gone are skipped and pruned")
    void orphanedSubscriptionsArePruned() {
        // Given
        fixture.connect("c1", "u1");
        fixture.connect("c2", "u2");
        fixture.join("d1", "c1");
        fixture.join("d1", "c2");
        fixture.store.deleteConnection("c2");

        // When & Then
        assertThat(index.subscribersOf("d1").block()).containsExactly("c1");
        assertThat(fixture.store.findTopicSubscribers("d1")).containsOnlyKeys("c1");
        assertThat(fixture.store.findConnectionTopics("c2")).isEmpty();
    }
}
