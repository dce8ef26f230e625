package com.example.realtime.gateway.auth;

import com.example.realtime.shared.config.AppProperties;
import io.jsonwebtoken.Claims;
import io.jsonwebtoken.JwtException;
import io.jsonwebtoken.JwtParser;
import io.jsonwebtoken.JwtParserBuilder;
import io.jsonwebtoken.Jwts;
import io.jsonwebtoken.security.Keys;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import javax.crypto.SecretKey;
import java.nio.charset.StandardCharsets;
import java.util.Optional;

/**
 * Verifies HS256-signed tokens; the subject claim is the user id. Without a configured secret every
 * connection is anonymous.
 */
@Component
@Slf4j
public class JwtIdentityVerifier implements IdentityVerifier {

    private static final int MIN_SECRET_LENGTH = 32;

    private final JwtParser parser;

    public JwtIdentityVerifier(AppProperties appProperties) {
        this.parser = buildParser(appProperties.getAuth());
    }

    private static JwtParser buildParser(AppProperties.Auth auth) {
        String secret = auth.getJwtSecret();
        if (secret == null || secret.isBlank()) {
            log.warn("No realtime.auth.jwt-secret configured, all connections will be anonymous");
            return null;
        }
        if (secret.length() < MIN_SECRET_LENGTH) {
            throw new IllegalStateException("realtime.auth.jwt-secret must be at least " + MIN_SECRET_LENGTH + " characters for HS256");
        }
        SecretKey key = Keys.hmacShaKeyFor(secret.getBytes(StandardCharsets.UTF_8));
        JwtParserBuilder builder = Jwts.parser().verifyWith(key);
        if (auth.getIssuer() != null && !auth.getIssuer().isBlank()) {
            builder.requireIssuer(auth.getIssuer());
        }
        return builder.build();
    }

    @Override
    public Optional<String> verify(String bearerToken) {
        if (parser == null || bearerToken == null || bearerToken.isBlank()) {
            return Optional.empty();
        }
        try {
            Claims claims = parser.parseSignedClaims(bearerToken.trim()).getPayload();
            return Optional.ofNullable(claims.getSubject()).filter(subject -> !subject.isBlank());
        } catch (JwtException | IllegalArgumentException e) {
            log.info("Rejected bearer token ({}): {}", mask(bearerToken), e.getMessage());
            return Optional.empty();
        }
    }

    private static String mask(String token) {
        return token.length() < 10 ? "***" : token.substring(0, 6) + "...";
    }
}
