package com.example.realtime.gateway.dto;

import lombok.Builder;
import lombok.Getter;
import lombok.ToString;

import java.util.Set;

/**
 * Outcome of one fan-out. Every attempted connection lands in exactly one of delivered, gone or failed.
 */
@Getter
@Builder
@ToString
public class DeliveryReport {

    private final String target;
    private final int attempted;
    @Builder.Default
    private final Set<String> delivered = Set.of();
    @Builder.Default
    private final Set<String> gone = Set.of();
    @Builder.Default
    private final Set<String> failed = Set.of();

    public static DeliveryReport empty(String target) {
        return DeliveryReport.builder().target(target).attempted(0).build();
    }
}
