package com.example.realtime.gateway.auth;

import java.util.Optional;

/**
 * Turns a bearer credential into a user id. An absent, malformed or rejected credential yields empty and the
 * connection stays anonymous.
 */
public interface IdentityVerifier {

    Optional<String> verify(String bearerToken);
}
