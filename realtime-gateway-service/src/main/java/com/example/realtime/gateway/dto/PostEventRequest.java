package com.example.realtime.gateway.dto;

import com.example.realtime.shared.util.Constants.PostMutationType;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.Map;

/**
 * Post mutation reported by an out-of-process CRUD handler after its write committed.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class PostEventRequest {

    @NotNull(message = "type is required")
    private PostMutationType type;

    @NotBlank(message = "postId is required")
    private String postId;

    /**
     * Reaction summary for {@code REACTION_CHANGED}, passed through to clients unchanged.
     */
    private Map<String, Object> reactionData;

    /**
     * New visibility for {@code VISIBILITY_CHANGED}.
     */
    private Boolean hidden;

    private String reason;
}
