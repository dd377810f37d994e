package com.social.feed.backend.feed.scoring;

import com.social.feed.backend.feed.vo.Candidate;

/**
 * 후보 게시글 점수 정책. 가중치는 설정값이며 랭킹 알고리즘(FeedRanker)과 분리된다.
 */
public interface FeedScoringPolicy {

    /**
     * 유저 관심사 대비 관련도.
     */
    double relevance(Candidate candidate, ScoringContext context);

    /**
     * 최종 점수 (클수록 상단).
     */
    double score(Candidate candidate, double relevance);

    ScoringPolicyType type();
}
