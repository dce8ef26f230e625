package com.example.realtime.gateway.service;

import com.example.realtime.gateway.support.PresenceFixture;
import com.example.realtime.shared.config.AppProperties;
import com.example.realtime.shared.exception.PresenceStoreException;
import com.example.realtime.shared.model.ConnectionRecord;
import com.example.realtime.shared.store.PresenceStore;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import reactor.core.scheduler.Schedulers;
import reactor.test.StepVerifier;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.Optional;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@DisplayName("ConnectionRegistry Tests")
class ConnectionRegistryTest {

    private final PresenceFixture fixture = new PresenceFixture();
    private final ConnectionRegistry registry = fixture.registry;

    @Test
    @DisplayName("open() writes the connection and a user link for authenticated sessions")
    void openAuthenticated() {
        // When
        fixture.connect("c1", "u1");

        // Then
        StepVerifier.create(registry.find("c1"))
                .assertNext(record -> {
                    assertThat(record.getUserId()).isEqualTo("u1");
                    assertThat(record.getExpiresAt()).isEqualTo(PresenceFixture.START.plus(Duration.ofHours(24)));
                })
                .verifyComplete();
        StepVerifier.create(registry.connectionsForUser("u1"))
                .expectNext(java.util.Set.of("c1"))
                .verifyComplete();
    }

    @Test
    @DisplayName("open() without a user writes no link")
    void openAnonymous() {
        fixture.connect("c1", null);

        assertThat(fixture.store.findConnection("c1")).isPresent();
        assertThat(fixture.store.findLinkedUsers("c1")).isEmpty();
    }

    @Test
    @DisplayName("touch() refreshes last activity but keeps the expiry")
    void touchRefreshesActivity() {
        // Given
        fixture.connect("c1", "u1");
        fixture.clock.advance(Duration.ofMinutes(10));

        // When & Then
        StepVerifier.create(registry.touch("c1"))
                .assertNext(record -> assertThat(record.getLastActivityAt())
                        .isEqualTo(PresenceFixture.START.plus(Duration.ofMinutes(10))))
                .verifyComplete();
        ConnectionRecord stored = fixture.store.findConnection("c1").orElseThrow();
        assertThat(stored.getLastActivityAt()).isEqualTo(PresenceFixture.START.plus(Duration.ofMinutes(10)));
        assertThat(stored.getExpiresAt()).isEqualTo(PresenceFixture.START.plus(Duration.ofHours(24)));
    }

    @Test
    @DisplayName("touch() of an unknown connection completes empty")
    void touchUnknown() {
        StepVerifier.create(registry.touch("missing")).verifyComplete();
    }

    @Test
    @DisplayName("Expired connections are treated as absent")
    void expiredConnectionIsAbsent() {
        // Given
        fixture.connect("c1", "u1");

        // When
        fixture.clock.advance(Duration.ofHours(24));

        // Then
        StepVerifier.create(registry.find("c1")).verifyComplete();
        StepVerifier.create(registry.touch("c1")).verifyComplete();
        StepVerifier.create(registry.connectionsForUser("u1"))
                .expectNext(java.util.Set.of())
                .verifyComplete();
    }

    @Test
    @DisplayName("close() removes the connection and its user links, and tolerates repeats")
    void closeRemovesEverything() {
        // Given
        fixture.connect("c1", "u1");

        // When
        registry.close("c1").block();
        registry.close("c1").block();

        // Then
        assertThat(fixture.store.findConnection("c1")).isEmpty();
        assertThat(fixture.store.findUserLinks("u1")).isEmpty();
    }

    @Test
    @DisplayName("connectionsForUser() prunes links whose connection record is gone")
    void orphanedLinksArePruned() {
        // Given
        fixture.connect("c1", "u1");
        fixture.connect("c2", "u1");
        fixture.store.deleteConnection("c2");

        // When & Then
        StepVerifier.create(registry.connectionsForUser("u1"))
                .expectNext(java.util.Set.of("c1"))
                .verifyComplete();
        assertThat(fixture.store.findUserLinks("u1")).containsOnlyKeys("c1");
    }

    @Test
    @DisplayName("Store failures on writes are swallowed")
    void writeFailuresAreSwallowed() {
        // Given
        PresenceStore failing = mock(PresenceStore.class);
        doThrow(new IllegalStateException("redis down")).when(failing).saveConnection(any(), any());
        ConnectionRegistry failingRegistry =
                new ConnectionRegistry(failing, new AppProperties(), Clock.systemUTC(), Schedulers.immediate());

        // When & Then
        StepVerifier.create(failingRegistry.open("c1", "u1")).verifyComplete();
    }

    @Test
    @DisplayName("touch() surfaces read failures as PresenceStoreException")
    void touchReadFailure() {
        // Given
        PresenceStore failing = mock(PresenceStore.class);
        when(failing.findConnection("c1")).thenThrow(new IllegalStateException("redis down"));
        ConnectionRegistry failingRegistry =
                new ConnectionRegistry(failing, new AppProperties(), Clock.systemUTC(), Schedulers.immediate());

        // When & Then
        StepVerifier.create(failingRegistry.touch("c1"))
                .expectError(PresenceStoreException.class)
                .verify();
    }

    @Test
    @DisplayName("touch() stores the lifetime left at the instant liveness was checked")
    void touchMeasuresRemainingLifetimeOnce() {
        // Given
        Instant expiresAt = PresenceFixture.START.plusSeconds(60);
        PresenceStore store = mock(PresenceStore.class);
        when(store.findConnection("c1")).thenReturn(Optional.of(ConnectionRecord.builder()
                .connectionId("c1").expiresAt(expiresAt).build()));
        Clock clock = mock(Clock.class);
        when(clock.instant()).thenReturn(expiresAt.minusMillis(500), expiresAt.plusSeconds(1));
        ConnectionRegistry boundaryRegistry =
                new ConnectionRegistry(store, new AppProperties(), clock, Schedulers.immediate());

        // When & Then
        StepVerifier.create(boundaryRegistry.touch("c1"))
                .assertNext(record -> assertThat(record.getLastActivityAt()).isEqualTo(expiresAt.minusMillis(500)))
                .verifyComplete();
        verify(store).saveConnection(any(), eq(Duration.ofMillis(500)));
    }

    @Test
    @DisplayName("touch() skips the write when less than a millisecond of lifetime is left")
    void touchSkipsWriteAtExpiryBoundary() {
        // Given
        Instant expiresAt = PresenceFixture.START.plusSeconds(60);
        PresenceStore store = mock(PresenceStore.class);
        when(store.findConnection("c1")).thenReturn(Optional.of(ConnectionRecord.builder()
                .connectionId("c1").expiresAt(expiresAt).build()));
        Clock clock = Clock.fixed(expiresAt.minusNanos(1_000), ZoneOffset.UTC);
        ConnectionRegistry boundaryRegistry =
                new ConnectionRegistry(store, new AppProperties(), clock, Schedulers.immediate());

        // When & Then
        StepVerifier.create(boundaryRegistry.touch("c1")).expectNextCount(1).verifyComplete();
        verify(store, never()).saveConnection(any(), any());
    }

    @Test
    @DisplayName("open() records the pod holding the socket")
    void openRecordsOwningPod() {
        // Given
        fixture.appProperties.setPodName("pod-a");

        // When
        fixture.connect("c1", "u1");

        // Then
        assertThat(fixture.store.findConnection("c1")).get()
                .extracting(ConnectionRecord::getPodId).isEqualTo("pod-a");
    }
}
