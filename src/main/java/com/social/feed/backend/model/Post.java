package com.social.feed.backend.model;

import jakarta.persistence.*;
import lombok.Getter;
import lombok.NoArgsConstructor;

@Entity
@Table(
        name = "POSTS",
        indexes = {
                @Index(name = "idx_post_user_created_at", columnList = "USER_ID, CREATED_AT")
        }
)
@Getter
@NoArgsConstructor
public class Post {

    @Id
    @Column(name = "POST_ID")
    private Long id;

    // 작성자 id만 보관 (연관관계 매핑 X)
    @Column(name = "USER_ID", nullable = false)
    private Long userId;

    @Column(name = "CONTENT", nullable = false, length = 4000)
    private String content;

    // ISO-8601 문자열 그대로 저장 (Instant#toString)
    @Column(name = "CREATED_AT", nullable = false, length = 40)
    private String createdAt;

    public static Post of(Long id, Long userId, String content, String createdAt) {
        Post p = new Post();
        p.id = id;
        p.userId = userId;
        p.content = content;
        p.createdAt = createdAt;
        return p;
    }
}
