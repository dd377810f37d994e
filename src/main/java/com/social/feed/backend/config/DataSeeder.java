package com.social.feed.backend.config;

import com.social.feed.backend.model.Comment;
import com.social.feed.backend.model.Post;
import com.social.feed.backend.model.User;
import com.social.feed.backend.repository.CommentRepository;
import com.social.feed.backend.repository.PostRepository;
import com.social.feed.backend.repository.UserRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.CommandLineRunner;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Clock;
import java.time.Instant;

/**
 * 기동 시 샘플 데이터: 유저 10 / 게시글 5 / 댓글 10.
 * 이미 데이터가 있으면 건너뜀.
 */
@Slf4j
@Configuration
@RequiredArgsConstructor
@ConditionalOnProperty(prefix = "feed.seed", name = "enabled", havingValue = "true", matchIfMissing = true)
public class DataSeeder {

    static final int USER_COUNT = 10;
    static final int POST_COUNT = 5;
    static final int COMMENT_COUNT = 10;

    private final UserRepository userRepository;
    private final PostRepository postRepository;
    private final CommentRepository commentRepository;
    private final Clock clock;

    @Bean
    CommandLineRunner seedSampleData() {
        return args -> {
            if (userRepository.count() > 0 || postRepository.count() > 0) {
                log.info("seed skipped (store not empty)");
                return;
            }

            for (long i = 0; i < USER_COUNT; i++) {
                userRepository.save(User.of(i, "User" + i));
            }

            for (long i = 0; i < POST_COUNT; i++) {
                postRepository.save(Post.of(i, i % USER_COUNT, "Post content " + i, now()));
            }

            for (long i = 0; i < COMMENT_COUNT; i++) {
                commentRepository.save(Comment.of(i, i % POST_COUNT, i % USER_COUNT, "Comment content " + i, now()));
            }

            log.info("seed done users={} posts={} comments={}", USER_COUNT, POST_COUNT, COMMENT_COUNT);
        };
    }

    private String now() {
        return Instant.now(clock).toString();
    }
}
