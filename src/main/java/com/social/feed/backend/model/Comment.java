package com.social.feed.backend.model;

import jakarta.persistence.*;
import lombok.Getter;
import lombok.NoArgsConstructor;

@Entity
@Table(
        name = "COMMENTS",
        indexes = {
                @Index(name = "idx_comment_post_user", columnList = "POST_ID, USER_ID")
        }
)
@Getter
@NoArgsConstructor
public class Comment {

    @Id
    @Column(name = "COMMENT_ID")
    private Long id;

    @Column(name = "POST_ID", nullable = false)
    private Long postId;

    @Column(name = "USER_ID", nullable = false)
    private Long userId;

    @Column(name = "CONTENT", nullable = false, length = 4000)
    private String content;

    @Column(name = "CREATED_AT", nullable = false, length = 40)
    private String createdAt;

    public static Comment of(Long id, Long postId, Long userId, String content, String createdAt) {
        Comment c = new Comment();
        c.id = id;
        c.postId = postId;
        c.userId = userId;
        c.content = content;
        c.createdAt = createdAt;
        return c;
    }
}
