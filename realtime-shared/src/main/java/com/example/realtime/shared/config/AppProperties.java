package com.example.realtime.shared.config;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Positive;
import lombok.Data;
import org.springframework.validation.annotation.Validated;

import java.time.Duration;

@Data
@Validated
public class AppProperties {

    private String podName;

    private final Presence presence = new Presence();
    private final Dispatch dispatch = new Dispatch();
    private final Auth auth = new Auth();
    private final Sweep sweep = new Sweep();

    public enum StoreType {
        REDIS,
        MEMORY
    }

    @Data
    public static class Presence {
        @NotNull
        private StoreType store = StoreType.REDIS;
        /**
         * Lifetime of connection, user-link and subscription records. Refreshed on every write.
         */
        @NotNull
        private Duration connectionTtl = Duration.ofHours(24);
        @NotBlank
        private String keyPrefix = "realtime:";
        @Positive
        private long maximumSize = 100_000;
    }

    @Data
    public static class Dispatch {
        @Positive
        private int concurrency = 64;
        @NotNull
        private Duration deliveryTimeout = Duration.ofSeconds(10);
    }

    @Data
    public static class Auth {
        /**
         * HMAC secret used to verify bearer tokens. Connections without a valid token stay anonymous.
         */
        private String jwtSecret;
        private String issuer;
    }

    @Data
    public static class Sweep {
        @NotNull
        private Duration interval = Duration.ofMinutes(5);
    }
}
