package com.example.realtime.gateway.service;

import com.example.realtime.gateway.dto.DeliveryReport;
import com.example.realtime.gateway.mapper.PostPayloadMapper;
import com.example.realtime.shared.dto.BroadcastEnvelope;
import com.example.realtime.shared.model.Post;
import com.example.realtime.shared.util.Constants.Actions;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import reactor.core.publisher.Mono;

import java.time.Clock;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Entry point for the post CRUD handlers: each method is called after the write committed and pushes the
 * change to everyone watching the discussion. Fire-and-forget; nothing here can fail the caller's mutation.
 */
@Service
@Slf4j
@RequiredArgsConstructor
public class PostMutationNotifier {

    private final BroadcastDispatcher broadcastDispatcher;
    private final UserDirectory userDirectory;
    private final PostPayloadMapper postPayloadMapper;
    private final Clock clock;

    public void postCreated(Post post) {
        fireAndForget(post.getDiscussionId(), Actions.NEW_POST, postEnvelope(Actions.NEW_POST, "create", post));
    }

    public void postUpdated(Post post) {
        fireAndForget(post.getDiscussionId(), Actions.POST_UPDATED, postEnvelope(Actions.POST_UPDATED, "update", post));
    }

    public void postDeleted(String postId, String discussionId) {
        Map<String, Object> data = postReference(postId, discussionId);
        data.put("metadata", metadata("delete", discussionId));
        fireAndForget(discussionId, Actions.POST_DELETED, Mono.just(envelope(Actions.POST_DELETED, data)));
    }

    public void reactionChanged(String postId, String discussionId, Map<String, Object> reactionData) {
        Map<String, Object> data = postReference(postId, discussionId);
        data.put("reactionData", reactionData);
        data.put("metadata", metadata("reaction", discussionId));
        fireAndForget(discussionId, Actions.POST_REACTION_CHANGED, Mono.just(envelope(Actions.POST_REACTION_CHANGED, data)));
    }

    public void visibilityChanged(String postId, String discussionId, boolean hidden, String reason) {
        Map<String, Object> data = postReference(postId, discussionId);
        data.put("isHidden", hidden);
        if (reason != null) {
            data.put("reason", reason);
        }
        data.put("metadata", metadata("visibility_change", discussionId));
        fireAndForget(discussionId, Actions.POST_VISIBILITY_CHANGED, Mono.just(envelope(Actions.POST_VISIBILITY_CHANGED, data)));
    }

    private Mono<BroadcastEnvelope> postEnvelope(String action, String mutation, Post post) {
        return Mono.defer(() -> userDirectory.displayNameOf(post.getAuthorId()))
                .map(authorName -> {
                    Map<String, Object> metadata = metadata(mutation, post.getDiscussionId());
                    metadata.put("discussionPointId", post.getDiscussionPointId());
                    metadata.put("authorId", post.getAuthorId());

                    Map<String, Object> data = new LinkedHashMap<>();
                    data.put("post", postPayloadMapper.toPayload(post, authorName));
                    data.put("metadata", metadata);
                    return envelope(action, data);
                });
    }

    private void fireAndForget(String discussionId, String action, Mono<BroadcastEnvelope> envelope) {
        envelope.flatMap(e -> broadcastDispatcher.broadcast(discussionId, e, null))
                .subscribe(
                        report -> logReport(discussionId, action, report),
                        error -> log.error("Failed to publish {} to discussion {}: {}", action, discussionId, error.getMessage(), error));
    }

    private void logReport(String discussionId, String action, DeliveryReport report) {
        log.info("Published {} to discussion {}: {}/{} delivered", action, discussionId,
                report.getDelivered().size(), report.getAttempted());
    }

    private BroadcastEnvelope envelope(String action, Map<String, Object> data) {
        return BroadcastEnvelope.of(action, data, clock.instant());
    }

    private Map<String, Object> postReference(String postId, String discussionId) {
        Map<String, Object> data = new LinkedHashMap<>();
        data.put("postId", postId);
        data.put("discussionId", discussionId);
        return data;
    }

    private Map<String, Object> metadata(String mutation, String discussionId) {
        Map<String, Object> metadata = new LinkedHashMap<>();
        metadata.put("action", mutation);
        metadata.put("discussionId", discussionId);
        return metadata;
    }
}
