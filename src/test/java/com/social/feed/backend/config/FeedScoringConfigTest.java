package com.social.feed.backend.config;

import com.social.feed.backend.feed.scoring.FeedScoringPolicy;
import com.social.feed.backend.feed.scoring.KeywordFrequencyScoringPolicy;
import com.social.feed.backend.feed.scoring.ScoringPolicyType;
import com.social.feed.backend.feed.scoring.WeightedLinearScoringPolicy;
import com.social.feed.backend.feed.service.FeedRankingProperties;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class FeedScoringConfigTest {

    private final FeedScoringConfig config = new FeedScoringConfig();

    @Test
    void weighted_linear_is_default() {
        FeedScoringPolicy policy = config.feedScoringPolicy(new FeedRankingProperties());

        assertInstanceOf(WeightedLinearScoringPolicy.class, policy);
    }

    @Test
    void keyword_frequency_can_be_selected() {
        FeedRankingProperties props = new FeedRankingProperties();
        props.setPolicy(ScoringPolicyType.KEYWORD_FREQUENCY);

        FeedScoringPolicy policy = config.feedScoringPolicy(props);

        assertInstanceOf(KeywordFrequencyScoringPolicy.class, policy);
        assertEquals(ScoringPolicyType.KEYWORD_FREQUENCY, policy.type());
    }
}
