package com.social.feed.backend.service;

import com.social.feed.backend.exception.BadRequestException;
import com.social.feed.backend.exception.ResourceAlreadyInUseException;
import com.social.feed.backend.exception.ResourceNotFoundException;
import com.social.feed.backend.exception.StoreException;
import com.social.feed.backend.model.Post;
import com.social.feed.backend.model.payload.request.CreatePostRequest;
import com.social.feed.backend.model.payload.response.CommentResponse;
import com.social.feed.backend.model.payload.response.PostResponse;
import com.social.feed.backend.model.payload.response.PostWithCommentsResponse;
import com.social.feed.backend.repository.CommentRepository;
import com.social.feed.backend.repository.PostRepository;
import com.social.feed.backend.repository.UserRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataAccessException;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;
import org.springframework.util.StringUtils;

import java.time.Clock;
import java.time.Instant;
import java.util.List;

@Slf4j
@Service
@RequiredArgsConstructor
public class PostService {

    private final PostRepository postRepository;
    private final CommentRepository commentRepository;
    private final UserRepository userRepository;
    private final Clock clock;

    @Transactional
    public Long create(CreatePostRequest req) {
        validate(req);

        try {
            if (!userRepository.existsById(req.getUserId())) {
                throw new ResourceNotFoundException("User", req.getUserId());
            }
            if (postRepository.existsById(req.getId())) {
                throw new ResourceAlreadyInUseException("Post", req.getId());
            }

            // 생성 시각은 서버 기준
            String createdAt = Instant.now(clock).toString();
            postRepository.saveAndFlush(Post.of(req.getId(), req.getUserId(), req.getContent(), createdAt));
        } catch (DataAccessException e) {
            throw new StoreException("Failed to create post", e);
        }

        log.info("post created id={} userId={}", req.getId(), req.getUserId());
        return req.getId();
    }

    @Transactional(readOnly = true)
    public PostWithCommentsResponse getPostWithComments(Long id) {
        Post post;
        try {
            post = postRepository.findById(id).orElse(null);
        } catch (DataAccessException e) {
            throw new StoreException("Failed to fetch post", e);
        }
        if (post == null) throw new ResourceNotFoundException("Post", id);

        List<CommentResponse> comments;
        try {
            comments = commentRepository.findByPostIdOrderByIdAsc(id)
                    .stream()
                    .map(CommentResponse::from)
                    .toList();
        } catch (DataAccessException e) {
            throw new StoreException("Failed to fetch comments", e);
        }

        return new PostWithCommentsResponse(PostResponse.from(post), comments);
    }

    private void validate(CreatePostRequest req) {
        if (req == null
                || req.getId() == null
                || req.getUserId() == null
                || !StringUtils.hasText(req.getContent())) {
            throw new BadRequestException("ID, user_id, and content are required");
        }
    }
}
