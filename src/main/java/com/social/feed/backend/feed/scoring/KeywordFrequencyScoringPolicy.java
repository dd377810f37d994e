package com.social.feed.backend.feed.scoring;

import com.social.feed.backend.feed.service.FeedRankingProperties;
import com.social.feed.backend.feed.vo.Candidate;
import com.social.feed.backend.feed.vo.InterestProfile;

/**
 * 키워드 빈도 기반 정책.
 * score = (Σ 관심사 가중치(본문 단어) + commentsCount * keywordCommentWeight) / (1 + recencyScore)
 */
public class KeywordFrequencyScoringPolicy implements FeedScoringPolicy {

    private final double commentWeight;

    public KeywordFrequencyScoringPolicy(FeedRankingProperties props) {
        this(props.getKeywordCommentWeight());
    }

    public KeywordFrequencyScoringPolicy(double commentWeight) {
        this.commentWeight = commentWeight;
    }

    @Override
    public double relevance(Candidate candidate, ScoringContext context) {
        String content = candidate.content();
        if (content == null || content.isEmpty()) return 0;

        InterestProfile profile = context.profile();

        // 본문은 공백 한 칸 기준으로 자름 (같은 단어가 여러 번 나오면 매번 더함)
        int sum = 0;
        for (String word : content.split(" ")) {
            sum += profile.weightOf(word);
        }
        return sum;
    }

    @Override
    public double score(Candidate candidate, double relevance) {
        double base = relevance + candidate.commentsCount() * commentWeight;
        double recencyFactor = 1 / (1 + candidate.recencyScore());
        return base * recencyFactor;
    }

    @Override
    public ScoringPolicyType type() {
        return ScoringPolicyType.KEYWORD_FREQUENCY;
    }
}
