package com.social.feed.backend.feed.dto;

import com.social.feed.backend.feed.vo.Candidate;
import com.social.feed.backend.feed.vo.RankedEntry;

public record FeedItemResponse(
        Long id,
        Long userId,
        String content,
        String createdAt,
        long commentsCount,
        double recencyScore,
        double relevanceScore,
        double score
) {
    public static FeedItemResponse from(RankedEntry e) {
        Candidate c = e.candidate();
        return new FeedItemResponse(
                c.id(),
                c.userId(),
                c.content(),
                c.createdAt(),
                c.commentsCount(),
                c.recencyScore(),
                e.relevanceScore(),
                e.score()
        );
    }
}
