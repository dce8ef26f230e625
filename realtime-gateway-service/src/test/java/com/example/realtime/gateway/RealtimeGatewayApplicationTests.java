package com.example.realtime.gateway;

import com.example.realtime.shared.config.CorrelationIdFilter;
import com.example.realtime.shared.model.Post;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.boot.test.web.server.LocalServerPort;
import org.springframework.data.jdbc.core.JdbcAggregateTemplate;
import org.springframework.http.MediaType;
import org.springframework.test.context.ActiveProfiles;
import org.springframework.test.web.reactive.server.WebTestClient;
import org.springframework.web.reactive.socket.WebSocketMessage;
import org.springframework.web.reactive.socket.client.ReactorNettyWebSocketClient;
import reactor.core.publisher.Mono;

import java.net.URI;
import java.time.Duration;
import java.time.OffsetDateTime;
import java.time.ZoneOffset;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CopyOnWriteArrayList;

import static org.assertj.core.api.Assertions.assertThat;

@SpringBootTest(webEnvironment = SpringBootTest.WebEnvironment.RANDOM_PORT)
@ActiveProfiles("test")
@DisplayName("Realtime gateway end-to-end Tests")
class RealtimeGatewayApplicationTests {

    @LocalServerPort
    private int port;

    @Autowired
    private WebTestClient webTestClient;

    @Autowired
    private JdbcAggregateTemplate jdbcAggregateTemplate;

    @Autowired
    private ObjectMapper objectMapper;

    @Test
    @DisplayName("Stats endpoint reports the pod and echoes a correlation id")
    void statsEndpoint() {
        webTestClient.get().uri("/api/realtime/stats")
                .header(CorrelationIdFilter.CORRELATION_ID_HEADER, "corr-1")
                .exchange()
                .expectStatus().isOk()
                .expectHeader().valueEquals(CorrelationIdFilter.CORRELATION_ID_HEADER, "corr-1")
                .expectBody()
                .jsonPath("$.podId").isNotEmpty()
                .jsonPath("$.liveConnections").isNumber();
    }

    @Test
    @DisplayName("Post events without a type are rejected with 400")
    void invalidPostEvent() {
        webTestClient.post().uri("/api/internal/discussions/d1/events")
                .contentType(MediaType.APPLICATION_JSON)
                .bodyValue(Map.of("postId", "p1"))
                .exchange()
                .expectStatus().isBadRequest()
                .expectBody()
                .jsonPath("$.error").isEqualTo("Validation Failed");
    }

    @Test
    @DisplayName("Created events for unknown posts are rejected with 404")
    void unknownPost() {
        webTestClient.post().uri("/api/internal/discussions/d1/events")
                .contentType(MediaType.APPLICATION_JSON)
                .bodyValue(Map.of("type", "CREATED", "postId", "does-not-exist"))
                .exchange()
                .expectStatus().isNotFound();
    }

    @Test
    @DisplayName("Events for stored posts and deletions are accepted")
    void acceptedPostEvents() {
        OffsetDateTime now = OffsetDateTime.now(ZoneOffset.UTC);
        jdbcAggregateTemplate.insert(Post.builder()
                .postId("accepted-post")
                .discussionId("d-accepted")
                .authorId("u1")
                .content("hello")
                .createdAt(now)
                .updatedAt(now)
                .build());

        webTestClient.post().uri("/api/internal/discussions/d-accepted/events")
                .contentType(MediaType.APPLICATION_JSON)
                .bodyValue(Map.of("type", "CREATED", "postId", "accepted-post"))
                .exchange()
                .expectStatus().isAccepted();

        webTestClient.post().uri("/api/internal/discussions/d-accepted/events")
                .contentType(MediaType.APPLICATION_JSON)
                .bodyValue(Map.of("type", "DELETED", "postId", "accepted-post"))
                .exchange()
                .expectStatus().isAccepted();
    }

    @Test
    @DisplayName("A WebSocket client can ping and join a discussion")
    void webSocketPingAndJoin() throws Exception {
        ReactorNettyWebSocketClient client = new ReactorNettyWebSocketClient();
        URI uri = URI.create("ws://localhost:" + port + "/ws");

        List<String> replies = new CopyOnWriteArrayList<>();
        client.execute(uri, session -> session.send(Mono.just(session.textMessage("{\"action\":\"ping\"}"))
                                .concatWith(Mono.just(session.textMessage(
                                        "{\"action\":\"join_discussion\",\"discussionId\":\"ws-d1\"}"))))
                        .thenMany(session.receive()
                                .map(WebSocketMessage::getPayloadAsText)
                                .doOnNext(replies::add)
                                .take(2))
                        .then())
                .block(Duration.ofSeconds(10));

        assertThat(replies).hasSize(2);
        JsonNode pong = objectMapper.readTree(replies.get(0));
        JsonNode joined = objectMapper.readTree(replies.get(1));
        assertThat(pong.get("action").asText()).isEqualTo("pong");
        assertThat(joined.get("action").asText()).isEqualTo("joined_discussion");
        assertThat(joined.get("data").get("discussionId").asText()).isEqualTo("ws-d1");
    }
}
