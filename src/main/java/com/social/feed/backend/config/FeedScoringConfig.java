package com.social.feed.backend.config;

import com.social.feed.backend.feed.scoring.FeedScoringPolicy;
import com.social.feed.backend.feed.scoring.KeywordFrequencyScoringPolicy;
import com.social.feed.backend.feed.scoring.WeightedLinearScoringPolicy;
import com.social.feed.backend.feed.service.FeedRankingProperties;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

@Slf4j
@Configuration
public class FeedScoringConfig {

    @Bean
    public FeedScoringPolicy feedScoringPolicy(FeedRankingProperties props) {
        FeedScoringPolicy policy = switch (props.getPolicy()) {
            case KEYWORD_FREQUENCY -> new KeywordFrequencyScoringPolicy(props);
            case WEIGHTED_LINEAR -> new WeightedLinearScoringPolicy(props);
        };
        log.info("feed scoring policy={}", policy.type());
        return policy;
    }
}
