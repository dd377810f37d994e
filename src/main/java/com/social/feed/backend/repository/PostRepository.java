package com.social.feed.backend.repository;

import com.social.feed.backend.model.Post;
import org.springframework.data.domain.Pageable;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

import java.util.List;

public interface PostRepository extends JpaRepository<Post, Long> {

    // 유저가 작성했거나 댓글을 단 게시글 (관심사 프로필 원천)
    @Query("""
        SELECT p
        FROM Post p
        WHERE p.userId = :userId
           OR p.id IN (
                SELECT c.postId
                FROM Comment c
                WHERE c.userId = :userId
           )
        ORDER BY p.id ASC
    """)
    List<Post> findInteractedByUserId(@Param("userId") Long userId);

    // 후보 조회: cursor 이후 + content LIKE pattern (pattern은 %...% 형태로 넘김)
    List<Post> findByIdGreaterThanAndContentLikeOrderByIdAsc(Long id, String pattern, Pageable pageable);

    // 관심사가 없는 유저용: content 조건 없음
    List<Post> findByIdGreaterThanOrderByIdAsc(Long id, Pageable pageable);
}
