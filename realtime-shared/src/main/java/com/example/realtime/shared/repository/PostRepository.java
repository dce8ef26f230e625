package com.example.realtime.shared.repository;

import com.example.realtime.shared.model.Post;
import org.springframework.data.jdbc.repository.query.Query;
import org.springframework.data.repository.CrudRepository;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.time.OffsetDateTime;
import java.util.List;

/**
 * Read access to posts owned by the discussion CRUD service.
 */
@Repository
public interface PostRepository extends CrudRepository<Post, String> {

    @Query("""
        SELECT * FROM posts
        WHERE discussion_id = :discussionId
          AND created_at > :since
        ORDER BY created_at ASC
    """)
    List<Post> findCreatedAfter(@Param("discussionId") String discussionId, @Param("since") OffsetDateTime since);

    /**
     * Posts touched after {@code since} by an edit, reaction or moderation action, as opposed to being created.
     */
    @Query("""
        SELECT * FROM posts
        WHERE discussion_id = :discussionId
          AND updated_at > :since
          AND updated_at <> created_at
        ORDER BY updated_at ASC
    """)
    List<Post> findUpdatedAfter(@Param("discussionId") String discussionId, @Param("since") OffsetDateTime since);
}
