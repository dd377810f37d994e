package com.social.feed.backend.service;

import com.social.feed.backend.exception.BadRequestException;
import com.social.feed.backend.exception.ResourceAlreadyInUseException;
import com.social.feed.backend.exception.ResourceNotFoundException;
import com.social.feed.backend.exception.StoreException;
import com.social.feed.backend.model.Comment;
import com.social.feed.backend.model.payload.request.CreateCommentRequest;
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

@Slf4j
@Service
@RequiredArgsConstructor
public class CommentService {

    private final CommentRepository commentRepository;
    private final PostRepository postRepository;
    private final UserRepository userRepository;
    private final Clock clock;

    // 피드 캐시는 건드리지 않음 (쓰기 후에도 기존 캐시 응답 유지)
    @Transactional
    public Long create(CreateCommentRequest req) {
        validate(req);

        try {
            if (!postRepository.existsById(req.getPostId())) {
                throw new ResourceNotFoundException("Post", req.getPostId());
            }
            if (!userRepository.existsById(req.getUserId())) {
                throw new ResourceNotFoundException("User", req.getUserId());
            }
            if (commentRepository.existsById(req.getId())) {
                throw new ResourceAlreadyInUseException("Comment", req.getId());
            }

            String createdAt = Instant.now(clock).toString();
            commentRepository.saveAndFlush(Comment.of(
                    req.getId(),
                    req.getPostId(),
                    req.getUserId(),
                    req.getContent(),
                    createdAt
            ));
        } catch (DataAccessException e) {
            throw new StoreException("Failed to create comment", e);
        }

        log.info("comment created id={} postId={} userId={}", req.getId(), req.getPostId(), req.getUserId());
        return req.getId();
    }

    private void validate(CreateCommentRequest req) {
        if (req == null
                || req.getId() == null
                || req.getPostId() == null
                || req.getUserId() == null
                || !StringUtils.hasText(req.getContent())) {
            throw new BadRequestException("ID, post_id, user_id, and content are required");
        }
    }
}
