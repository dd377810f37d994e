package com.social.feed.backend.feed.service;

import com.social.feed.backend.exception.DataIntegrityException;
import com.social.feed.backend.feed.scoring.FeedScoringPolicy;
import com.social.feed.backend.feed.scoring.ScoringContext;
import com.social.feed.backend.feed.vo.Candidate;
import com.social.feed.backend.feed.vo.InterestProfile;
import com.social.feed.backend.feed.vo.RankedEntry;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;

@Component
@RequiredArgsConstructor
public class FeedRanker {

    private final FeedScoringPolicy scoringPolicy;

    /**
     * 점수 내림차순. List.sort는 stable이라 동점이면 후보 조회 순서 유지.
     */
    public List<RankedEntry> rank(List<Candidate> candidates, InterestProfile profile) {
        List<RankedEntry> ranked = new ArrayList<>(candidates.size());
        ScoringContext context = ScoringContext.of(profile);

        for (Candidate c : candidates) {
            double relevance = scoringPolicy.relevance(c, context);
            double score = scoringPolicy.score(c, relevance);

            if (Double.isNaN(score) || Double.isInfinite(score)) {
                throw new DataIntegrityException("Non-finite score for post " + c.id() + ": " + score);
            }
            ranked.add(new RankedEntry(c, relevance, score));
        }

        ranked.sort(Comparator.comparingDouble(RankedEntry::score).reversed());
        return ranked;
    }
}
