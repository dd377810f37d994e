package com.social.feed.backend.feed.service;

import com.social.feed.backend.exception.DataIntegrityException;
import com.social.feed.backend.feed.scoring.FeedScoringPolicy;
import com.social.feed.backend.feed.scoring.LikePattern;
import com.social.feed.backend.feed.scoring.ScoringContext;
import com.social.feed.backend.feed.scoring.ScoringPolicyType;
import com.social.feed.backend.feed.scoring.WeightedLinearScoringPolicy;
import com.social.feed.backend.feed.vo.Candidate;
import com.social.feed.backend.feed.vo.InterestProfile;
import com.social.feed.backend.feed.vo.RankedEntry;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class FeedRankerTest {

    private final FeedRanker ranker = new FeedRanker(new WeightedLinearScoringPolicy(new FeedRankingProperties()));

    private static Candidate candidate(long id, String content, long comments, double recency) {
        return new Candidate(id, 0L, content, "2026-01-01T00:00:00Z", comments, recency);
    }

    @Test
    void ranks_by_score_descending() {
        InterestProfile profile = new InterestProfile("spring", Map.of("spring", 1));
        List<Candidate> candidates = List.of(
                candidate(1, "spring intro", 0, 0),   // 1.5
                candidate(2, "spring deep", 3, 0),    // 3.6 + 1.5
                candidate(3, "other", 1, 1)           // 1.2 + 0.8 + 1.0
        );

        List<RankedEntry> ranked = ranker.rank(candidates, profile);

        assertEquals(List.of(2L, 3L, 1L), ranked.stream().map(RankedEntry::id).toList());
        for (int i = 1; i < ranked.size(); i++) {
            assertTrue(ranked.get(i - 1).score() >= ranked.get(i).score());
        }
    }

    @Test
    void equal_scores_keep_candidate_order() {
        List<Candidate> candidates = List.of(
                candidate(7, "a", 1, 0),
                candidate(3, "b", 2, 0),
                candidate(5, "c", 1, 0),
                candidate(1, "d", 1, 0)
        );

        List<RankedEntry> ranked = ranker.rank(candidates, InterestProfile.empty());

        // 3이 최고점, 나머지 동점은 입력 순서 7, 5, 1
        assertEquals(List.of(3L, 7L, 5L, 1L), ranked.stream().map(RankedEntry::id).toList());
        assertEquals(1.5, ranked.get(0).relevanceScore());
    }

    @Test
    void empty_candidates_rank_to_empty_list() {
        assertTrue(ranker.rank(List.of(), InterestProfile.empty()).isEmpty());
    }

    @Test
    void non_finite_score_is_data_integrity_failure() {
        FeedScoringPolicy broken = new FeedScoringPolicy() {
            @Override
            public double relevance(Candidate candidate, ScoringContext context) {
                return 0;
            }

            @Override
            public double score(Candidate candidate, double relevance) {
                return Double.NaN;
            }

            @Override
            public ScoringPolicyType type() {
                return ScoringPolicyType.WEIGHTED_LINEAR;
            }
        };

        FeedRanker nanRanker = new FeedRanker(broken);

        DataIntegrityException ex = assertThrows(DataIntegrityException.class,
                () -> nanRanker.rank(List.of(candidate(9, "x", 0, 0)), InterestProfile.empty()));
        assertTrue(ex.getMessage().contains("post 9"));
    }

    @Test
    void interest_pattern_is_compiled_once_per_rank() {
        List<LikePattern> seen = new ArrayList<>();
        FeedScoringPolicy recording = new FeedScoringPolicy() {
            @Override
            public double relevance(Candidate candidate, ScoringContext context) {
                seen.add(context.interestPattern());
                return 1;
            }

            @Override
            public double score(Candidate candidate, double relevance) {
                return relevance;
            }

            @Override
            public ScoringPolicyType type() {
                return ScoringPolicyType.WEIGHTED_LINEAR;
            }
        };

        new FeedRanker(recording).rank(
                List.of(candidate(1, "a", 0, 0), candidate(2, "b", 0, 0), candidate(3, "c", 0, 0)),
                new InterestProfile("spring", Map.of("spring", 1)));

        assertEquals(3, seen.size());
        assertEquals("%spring%", seen.get(0).source());
        assertSame(seen.get(0), seen.get(1));
        assertSame(seen.get(0), seen.get(2));
    }
}
