package com.example.realtime.gateway.service;

import reactor.core.publisher.Mono;

/**
 * Source of display names. Never errors: an unknown user or a lookup failure yields "Unknown User".
 */
public interface UserDirectory {

    Mono<String> displayNameOf(String userId);
}
