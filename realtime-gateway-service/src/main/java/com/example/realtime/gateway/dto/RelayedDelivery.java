package com.example.realtime.gateway.dto;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * A serialized frame handed to the pod that owns the target connection.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class RelayedDelivery {
    private String connectionId;
    private String payload;
    private String originPodId;
}
