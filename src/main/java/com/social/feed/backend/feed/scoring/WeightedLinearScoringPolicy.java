package com.social.feed.backend.feed.scoring;

import com.social.feed.backend.feed.service.FeedRankingProperties;
import com.social.feed.backend.feed.vo.Candidate;

/**
 * score = commentsCount * commentWeight + recencyScore * recencyWeight + relevance
 * relevance = 관심사 LIKE 패턴에 매칭되면 relevanceMatchScore, 아니면 relevanceMissScore
 */
public class WeightedLinearScoringPolicy implements FeedScoringPolicy {

    private final double commentWeight;
    private final double recencyWeight;
    private final double relevanceMatchScore;
    private final double relevanceMissScore;

    public WeightedLinearScoringPolicy(FeedRankingProperties props) {
        this(
                props.getCommentWeight(),
                props.getRecencyWeight(),
                props.getRelevanceMatchScore(),
                props.getRelevanceMissScore()
        );
    }

    public WeightedLinearScoringPolicy(double commentWeight,
                                       double recencyWeight,
                                       double relevanceMatchScore,
                                       double relevanceMissScore) {
        this.commentWeight = commentWeight;
        this.recencyWeight = recencyWeight;
        this.relevanceMatchScore = relevanceMatchScore;
        this.relevanceMissScore = relevanceMissScore;
    }

    @Override
    public double relevance(Candidate candidate, ScoringContext context) {
        return context.interestPattern().matches(candidate.content()) ? relevanceMatchScore : relevanceMissScore;
    }

    @Override
    public double score(Candidate candidate, double relevance) {
        return candidate.commentsCount() * commentWeight
                + candidate.recencyScore() * recencyWeight
                + relevance;
    }

    @Override
    public ScoringPolicyType type() {
        return ScoringPolicyType.WEIGHTED_LINEAR;
    }
}
