package com.example.realtime.gateway.controller;

import com.example.realtime.gateway.dto.PostEventRequest;
import com.example.realtime.gateway.service.PostMutationNotifier;
import com.example.realtime.shared.model.Post;
import com.example.realtime.shared.repository.PostRepository;
import io.github.resilience4j.ratelimiter.RequestNotPermitted;
import io.github.resilience4j.ratelimiter.annotation.RateLimiter;
import jakarta.validation.Valid;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.http.HttpStatus;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.ResponseStatus;
import org.springframework.web.bind.annotation.RestController;
import org.springframework.web.server.ResponseStatusException;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Scheduler;

/**
 * Ingress for post CRUD handlers running in other processes. Accepts the event once the referenced post has
 * been resolved; fan-out happens after the response.
 */
@RestController
@RequestMapping("/api/internal")
@Slf4j
public class PostEventController {

    private final PostMutationNotifier postMutationNotifier;
    private final PostRepository postRepository;
    private final Scheduler jdbcScheduler;

    public PostEventController(PostMutationNotifier postMutationNotifier,
                               PostRepository postRepository,
                               @Qualifier("jdbcScheduler") Scheduler jdbcScheduler) {
        this.postMutationNotifier = postMutationNotifier;
        this.postRepository = postRepository;
        this.jdbcScheduler = jdbcScheduler;
    }

    @PostMapping("/discussions/{discussionId}/events")
    @ResponseStatus(HttpStatus.ACCEPTED)
    @RateLimiter(name = "postEventIngress", fallbackMethod = "publishFallback")
    public Mono<Void> publish(@PathVariable String discussionId, @Valid @RequestBody PostEventRequest request) {
        log.info("Post event {} for post {} in discussion {}", request.getType(), request.getPostId(), discussionId);

        return switch (request.getType()) {
            case CREATED -> loadPost(discussionId, request.getPostId())
                    .doOnNext(postMutationNotifier::postCreated)
                    .then();
            case UPDATED -> loadPost(discussionId, request.getPostId())
                    .doOnNext(postMutationNotifier::postUpdated)
                    .then();
            case DELETED -> Mono.fromRunnable(() -> postMutationNotifier.postDeleted(request.getPostId(), discussionId));
            case REACTION_CHANGED -> Mono.fromRunnable(() -> postMutationNotifier.reactionChanged(
                    request.getPostId(), discussionId, request.getReactionData()));
            case VISIBILITY_CHANGED -> {
                if (request.getHidden() == null) {
                    yield Mono.error(new ResponseStatusException(HttpStatus.BAD_REQUEST,
                            "hidden is required for VISIBILITY_CHANGED"));
                }
                yield Mono.fromRunnable(() -> postMutationNotifier.visibilityChanged(
                        request.getPostId(), discussionId, request.getHidden(), request.getReason()));
            }
        };
    }

    public Mono<Void> publishFallback(String discussionId, PostEventRequest request, RequestNotPermitted ex) {
        log.warn("Post event ingress rate limit exceeded for discussion {}: {}", discussionId, ex.getMessage());
        return Mono.error(new ResponseStatusException(HttpStatus.TOO_MANY_REQUESTS,
                "Event rate limit exceeded. Please retry later."));
    }

    private Mono<Post> loadPost(String discussionId, String postId) {
        return Mono.fromCallable(() -> postRepository.findById(postId))
                .subscribeOn(jdbcScheduler)
                .flatMap(Mono::justOrEmpty)
                .filter(post -> discussionId.equals(post.getDiscussionId()))
                .switchIfEmpty(Mono.error(new ResponseStatusException(HttpStatus.NOT_FOUND,
                        "Post " + postId + " not found in discussion " + discussionId)));
    }
}
