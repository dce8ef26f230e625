package com.example.realtime.gateway.dto;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.Map;

/**
 * Inbound client frame: {@code {action, discussionId?, data?}}.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonIgnoreProperties(ignoreUnknown = true)
public class ControlMessage {
    private String action;
    private String discussionId;
    private Map<String, Object> data;

    public Object dataValue(String key) {
        return data == null ? null : data.get(key);
    }
}
