package com.example.realtime.gateway.service;

import com.example.realtime.gateway.mapper.PostPayloadMapper;
import com.example.realtime.shared.config.MonitoringConfig;
import com.example.realtime.shared.dto.DomainEvent;
import com.example.realtime.shared.model.Post;
import com.example.realtime.shared.repository.PostRepository;
import com.example.realtime.shared.util.Constants.DomainEventType;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Service;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Scheduler;
import reactor.util.function.Tuples;

import java.time.Instant;
import java.time.OffsetDateTime;
import java.time.ZoneOffset;
import java.time.format.DateTimeParseException;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Rebuilds the post changes a client missed while disconnected, straight from the post table.
 * <p>
 * Created posts are governed by their creation time, every later change by the last update time. Results are
 * ordered by governing time with creations ahead of updates on ties, and every result is strictly newer than
 * the watermark. Reading is side-effect free, so a client may repeat a sync as often as it likes.
 */
@Service
@Slf4j
public class MissedMessageReconciler {

    private final PostRepository postRepository;
    private final UserDirectory userDirectory;
    private final PostPayloadMapper postPayloadMapper;
    private final Scheduler jdbcScheduler;
    private final MonitoringConfig.RealtimeMetricsCollector metricsCollector;

    public MissedMessageReconciler(PostRepository postRepository,
                                   UserDirectory userDirectory,
                                   PostPayloadMapper postPayloadMapper,
                                   @Qualifier("jdbcScheduler") Scheduler jdbcScheduler,
                                   MonitoringConfig.RealtimeMetricsCollector metricsCollector) {
        this.postRepository = postRepository;
        this.userDirectory = userDirectory;
        this.postPayloadMapper = postPayloadMapper;
        this.jdbcScheduler = jdbcScheduler;
        this.metricsCollector = metricsCollector;
    }

    /**
     * Accepts an ISO-8601 instant ({@code 2024-05-01T10:00:00Z}) or an offset date-time. Blank or unparseable
     * input counts as "no watermark".
     */
    public static Optional<Instant> parseWatermark(String raw) {
        if (raw == null || raw.isBlank()) {
            return Optional.empty();
        }
        try {
            return Optional.of(Instant.parse(raw.trim()));
        } catch (DateTimeParseException notAnInstant) {
            try {
                return Optional.of(OffsetDateTime.parse(raw.trim()).toInstant());
            } catch (DateTimeParseException e) {
                log.warn("Ignoring unparseable sync watermark '{}'", raw);
                return Optional.empty();
            }
        }
    }

    public Mono<List<DomainEvent>> reconcile(String discussionId, String userId, String lastSyncTimestamp) {
        return reconcile(discussionId, userId, parseWatermark(lastSyncTimestamp).orElse(null));
    }

    public Mono<List<DomainEvent>> reconcile(String discussionId, String userId, Instant since) {
        if (since == null) {
            log.debug("Sync for discussion {} by user {} without watermark", discussionId, userId);
            return Mono.just(List.of());
        }
        OffsetDateTime watermark = since.atOffset(ZoneOffset.UTC);
        long start = System.currentTimeMillis();

        return Mono.fromCallable(() -> Tuples.of(
                        postRepository.findCreatedAfter(discussionId, watermark),
                        postRepository.findUpdatedAfter(discussionId, watermark)))
                .subscribeOn(jdbcScheduler)
                .flatMap(posts -> Flux.concat(
                                Flux.fromIterable(posts.getT1()).concatMap(this::toCreatedEvent),
                                Flux.fromIterable(posts.getT2()).concatMap(this::toChangeEvent))
                        .filter(event -> event.getTimestamp().isAfter(since))
                        .collectList())
                .map(events -> {
                    List<DomainEvent> ordered = new ArrayList<>(events);
                    ordered.sort(Comparator.comparing(DomainEvent::getTimestamp));
                    return ordered;
                })
                .doOnNext(events -> {
                    metricsCollector.recordTimer("realtime.sync.latency", System.currentTimeMillis() - start);
                    log.info("Sync for discussion {} by user {} since {}: {} missed event(s)",
                            discussionId, userId, since, events.size());
                })
                .onErrorResume(e -> {
                    log.error("Sync for discussion {} by user {} failed, returning nothing: {}",
                            discussionId, userId, e.getMessage());
                    return Mono.just(List.of());
                });
    }

    private Mono<DomainEvent> toCreatedEvent(Post post) {
        return userDirectory.displayNameOf(post.getAuthorId())
                .map(authorName -> DomainEvent.builder()
                        .type(DomainEventType.POST_CREATED)
                        .discussionId(post.getDiscussionId())
                        .postId(post.getPostId())
                        .timestamp(post.getCreatedAt().toInstant())
                        .userId(post.getAuthorId())
                        .data(Map.of("post", postPayloadMapper.toPayload(post, authorName)))
                        .build());
    }

    private Mono<DomainEvent> toChangeEvent(Post post) {
        Instant updatedAt = post.getUpdatedAt().toInstant();
        if (post.isDeleted()) {
            Map<String, Object> data = moderationData(post);
            data.put("deletedBy", post.getDeletedBy());
            data.put("deletedAt", isoOrNull(post.getDeletedAt()));
            return Mono.just(changeEvent(DomainEventType.POST_DELETED, post, updatedAt, data));
        }
        if (post.isHidden()) {
            Map<String, Object> data = moderationData(post);
            data.put("hiddenBy", post.getHiddenBy());
            data.put("hiddenAt", isoOrNull(post.getHiddenAt()));
            return Mono.just(changeEvent(DomainEventType.POST_HIDDEN, post, updatedAt, data));
        }
        return userDirectory.displayNameOf(post.getAuthorId())
                .map(authorName -> changeEvent(DomainEventType.POST_UPDATED, post, updatedAt,
                        Map.of("post", postPayloadMapper.toPayload(post, authorName))));
    }

    private DomainEvent changeEvent(DomainEventType type, Post post, Instant timestamp, Map<String, Object> data) {
        return DomainEvent.builder()
                .type(type)
                .discussionId(post.getDiscussionId())
                .postId(post.getPostId())
                .timestamp(timestamp)
                .data(data)
                .build();
    }

    private Map<String, Object> moderationData(Post post) {
        Map<String, Object> data = new LinkedHashMap<>();
        data.put("postId", post.getPostId());
        data.put("discussionId", post.getDiscussionId());
        return data;
    }

    private String isoOrNull(OffsetDateTime dateTime) {
        return dateTime == null ? null : dateTime.toInstant().toString();
    }
}
