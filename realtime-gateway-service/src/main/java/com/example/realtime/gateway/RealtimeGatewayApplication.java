package com.example.realtime.gateway;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

/**
 * Real-time gateway for discussions.
 *
 * - WebSocket transport with per-connection outbound sinks
 * - Connection registry and discussion subscription index in Redis (or Caffeine on a single node)
 * - Concurrent fan-out of post changes to discussion subscribers
 * - Missed-message sync against the post record store after a reconnect
 */
@SpringBootApplication(scanBasePackages = {"com.example.realtime.gateway", "com.example.realtime.shared"})
public class RealtimeGatewayApplication {

    public static void main(String[] args) {
        SpringApplication.run(RealtimeGatewayApplication.class, args);
    }
}
