package com.example.realtime.gateway.dto;

import com.fasterxml.jackson.annotation.JsonInclude;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.Map;

/**
 * Client-facing shape of a post inside {@code new_post} and {@code post_updated} envelopes.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonInclude(JsonInclude.Include.NON_NULL)
public class PostPayload {
    private String id;
    private String discussionId;
    private String discussionPointId;
    private String authorId;
    private String authorName;
    private String content;
    private String stance;
    private String createdAt;
    private String updatedAt;
    private Map<String, Object> reactions;
    private String replyToId;
}
