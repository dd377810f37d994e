package com.social.feed.backend.feed.service;

import com.social.feed.backend.exception.DataIntegrityException;
import com.social.feed.backend.feed.vo.Candidate;
import com.social.feed.backend.feed.vo.InterestProfile;
import com.social.feed.backend.model.Post;
import com.social.feed.backend.repository.CommentRepository;
import com.social.feed.backend.repository.PostRepository;
import lombok.RequiredArgsConstructor;
import org.springframework.data.domain.PageRequest;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.format.DateTimeParseException;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

@Component
@RequiredArgsConstructor
public class CandidateFetcher {

    private static final double MILLIS_PER_DAY = Duration.ofDays(1).toMillis();

    private final PostRepository postRepository;
    private final CommentRepository commentRepository;
    private final Clock clock;

    /**
     * id > lowerBound 이고 content가 관심사 패턴을 포함하는 게시글을 id 순으로 최대 batchSize개.
     * 순서는 최종 순서가 아니다 (FeedRanker가 다시 정렬).
     */
    public List<Candidate> fetchCandidates(InterestProfile profile, long lowerBound, int batchSize) {
        PageRequest limit = PageRequest.of(0, batchSize);

        // 빈 프로필은 "%%"로 넘겨도 되지만 조건 자체를 빼서 전체 매칭을 보장
        List<Post> posts = profile.isEmpty()
                ? postRepository.findByIdGreaterThanOrderByIdAsc(lowerBound, limit)
                : postRepository.findByIdGreaterThanAndContentLikeOrderByIdAsc(lowerBound, toStorePattern(profile.likePattern()), limit);

        if (posts.isEmpty()) return List.of();

        Map<Long, Long> commentCounts = countComments(posts);
        Instant now = Instant.now(clock);

        List<Candidate> candidates = new ArrayList<>(posts.size());
        for (Post p : posts) {
            candidates.add(new Candidate(
                    p.getId(),
                    p.getUserId(),
                    p.getContent(),
                    p.getCreatedAt(),
                    commentCounts.getOrDefault(p.getId(), 0L),
                    recencyDays(p, now)
            ));
        }
        return candidates;
    }

    /**
     * 파생 Like 쿼리는 '\'를 이스케이프 문자로 쓴다.
     * '\'를 두 번 써서 리터럴로 만들고, '%' '_'는 와일드카드로 남긴다 (LikePattern과 동일).
     */
    static String toStorePattern(String likePattern) {
        return likePattern.replace("\\", "\\\\");
    }

    private Map<Long, Long> countComments(List<Post> posts) {
        List<Long> ids = posts.stream().map(Post::getId).toList();

        Map<Long, Long> counts = new HashMap<>();
        for (CommentRepository.PostCommentCount row : commentRepository.countByPostIds(ids)) {
            counts.put(row.getPostId(), row.getCommentCount());
        }
        return counts;
    }

    static double recencyDays(Post post, Instant now) {
        if (post.getCreatedAt() == null) {
            throw new DataIntegrityException("Missing created_at for post " + post.getId());
        }

        Instant createdAt;
        try {
            createdAt = Instant.parse(post.getCreatedAt());
        } catch (DateTimeParseException e) {
            throw new DataIntegrityException(
                    "Unparseable created_at for post " + post.getId() + ": " + post.getCreatedAt(), e);
        }

        double days = Duration.between(createdAt, now).toMillis() / MILLIS_PER_DAY;
        // 미래 시각(시계 오차)은 0으로
        return Math.max(0d, days);
    }
}
