package com.example.realtime.gateway.service;

import com.example.realtime.shared.model.UserProfile;
import com.example.realtime.shared.repository.UserProfileRepository;
import com.example.realtime.shared.util.Constants;
import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Service;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Scheduler;

import java.time.Duration;

/**
 * Reads display names from the user profile table and keeps them for a few minutes.
 */
@Service
@Slf4j
public class JdbcUserDirectory implements UserDirectory {

    private final UserProfileRepository userProfileRepository;
    private final Scheduler jdbcScheduler;
    private final Cache<String, String> displayNames = Caffeine.newBuilder()
            .maximumSize(10_000)
            .expireAfterWrite(Duration.ofMinutes(5))
            .build();

    public JdbcUserDirectory(UserProfileRepository userProfileRepository,
                             @Qualifier("jdbcScheduler") Scheduler jdbcScheduler) {
        this.userProfileRepository = userProfileRepository;
        this.jdbcScheduler = jdbcScheduler;
    }

    @Override
    public Mono<String> displayNameOf(String userId) {
        if (userId == null) {
            return Mono.just(Constants.UNKNOWN_USER_NAME);
        }
        String cached = displayNames.getIfPresent(userId);
        if (cached != null) {
            return Mono.just(cached);
        }
        return Mono.fromCallable(() -> userProfileRepository.findById(userId)
                        .map(UserProfile::getDisplayName)
                        .filter(name -> !name.isBlank()))
                .subscribeOn(jdbcScheduler)
                .map(name -> name.map(found -> {
                    displayNames.put(userId, found);
                    return found;
                }).orElse(Constants.UNKNOWN_USER_NAME))
                .onErrorResume(e -> {
                    log.warn("Display name lookup for user {} failed: {}", userId, e.getMessage());
                    return Mono.just(Constants.UNKNOWN_USER_NAME);
                });
    }
}
