package com.example.realtime.gateway.websocket;

import com.example.realtime.gateway.auth.IdentityVerifier;
import com.example.realtime.gateway.service.ConnectionRegistry;
import com.example.realtime.gateway.service.StaleConnectionReaper;
import com.example.realtime.shared.config.MonitoringConfig;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpHeaders;
import org.springframework.stereotype.Component;
import org.springframework.web.reactive.socket.HandshakeInfo;
import org.springframework.web.reactive.socket.WebSocketHandler;
import org.springframework.web.reactive.socket.WebSocketMessage;
import org.springframework.web.reactive.socket.WebSocketSession;
import org.springframework.web.util.UriComponentsBuilder;
import reactor.core.publisher.Mono;

import java.util.UUID;

/**
 * Lifecycle of one client WebSocket: register on open, route inbound frames one at a time, drain the outbound
 * stream, and reap all presence state when either side ends.
 */
@Component
@Slf4j
@RequiredArgsConstructor
public class RealtimeWebSocketHandler implements WebSocketHandler {

    static final String TOKEN_PARAM = "token";
    private static final String BEARER_PREFIX = "Bearer ";

    private final WebSocketSessionManager sessionManager;
    private final ConnectionRegistry connectionRegistry;
    private final StaleConnectionReaper reaper;
    private final ControlMessageRouter router;
    private final IdentityVerifier identityVerifier;
    private final MonitoringConfig.RealtimeMetricsCollector metricsCollector;

    @Override
    public Mono<Void> handle(WebSocketSession session) {
        String connectionId = UUID.randomUUID().toString();
        String userId = identityVerifier.verify(extractToken(session.getHandshakeInfo())).orElse(null);
        log.info("[CONNECT] WebSocket session {} opened as connection {} (user: {})",
                session.getId(), connectionId, userId != null ? userId : "anonymous");
        metricsCollector.incrementCounter("realtime.connections.opened", "authenticated", String.valueOf(userId != null));

        Mono<Void> output = session.send(sessionManager.createOutboundStream(connectionId).map(session::textMessage));

        Mono<Void> input = session.receive()
                .filter(message -> message.getType() == WebSocketMessage.Type.TEXT)
                .map(WebSocketMessage::getPayloadAsText)
                .concatMap(frame -> router.route(connectionId, frame))
                .then();

        return connectionRegistry.open(connectionId, userId)
                .then(Mono.zip(input, output).then())
                .doOnError(e -> log.warn("WebSocket connection {} failed: {}", connectionId, e.getMessage()))
                .doFinally(signal -> {
                    log.info("[DISCONNECT] Connection {} ended ({})", connectionId, signal);
                    sessionManager.removeOutboundStream(connectionId);
                    reaper.reap(connectionId).subscribe(
                            null,
                            e -> log.warn("Reap after disconnect of {} failed: {}", connectionId, e.getMessage()));
                });
    }

    String extractToken(HandshakeInfo handshakeInfo) {
        String fromQuery = UriComponentsBuilder.fromUri(handshakeInfo.getUri()).build()
                .getQueryParams().getFirst(TOKEN_PARAM);
        if (fromQuery != null && !fromQuery.isBlank()) {
            return fromQuery;
        }
        String authorization = handshakeInfo.getHeaders().getFirst(HttpHeaders.AUTHORIZATION);
        if (authorization != null && authorization.startsWith(BEARER_PREFIX)) {
            return authorization.substring(BEARER_PREFIX.length());
        }
        return null;
    }
}
