package com.social.feed.backend.repository;

import com.social.feed.backend.model.Comment;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

import java.util.Collection;
import java.util.List;

public interface CommentRepository extends JpaRepository<Comment, Long> {

    List<Comment> findByPostIdOrderByIdAsc(Long postId);

    @Query("""
        SELECT c.postId AS postId, COUNT(c) AS commentCount
        FROM Comment c
        WHERE c.postId IN :postIds
        GROUP BY c.postId
    """)
    List<PostCommentCount> countByPostIds(@Param("postIds") Collection<Long> postIds);

    interface PostCommentCount {
        Long getPostId();
        Long getCommentCount();
    }
}
