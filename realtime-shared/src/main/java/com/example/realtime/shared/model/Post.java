package com.example.realtime.shared.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;
import org.springframework.data.annotation.Id;
import org.springframework.data.relational.core.mapping.Column;
import org.springframework.data.relational.core.mapping.Table;

import java.time.OffsetDateTime;

/**
 * Read-only view of a post as written by the discussion CRUD service.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@Table("posts")
public class Post {
    @Id
    private String postId;
    private String discussionId;
    private String discussionPointId;
    private String authorId;
    private String content;
    private String stance;
    private String replyToId;
    /**
     * Reaction counts as a JSON object, e.g. {"agree":3,"disagree":1}.
     */
    private String reactions;
    private OffsetDateTime createdAt;
    private OffsetDateTime updatedAt;
    @Column("is_deleted")
    private boolean deleted;
    private String deletedBy;
    private OffsetDateTime deletedAt;
    @Column("is_hidden")
    private boolean hidden;
    private String hiddenBy;
    private OffsetDateTime hiddenAt;
    private String hiddenReason;

    public boolean isEdited() {
        return updatedAt != null && createdAt != null && !updatedAt.isEqual(createdAt);
    }
}
