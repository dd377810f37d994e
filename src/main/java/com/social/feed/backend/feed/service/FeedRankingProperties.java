package com.social.feed.backend.feed.service;

import com.social.feed.backend.feed.scoring.ScoringPolicyType;
import lombok.Getter;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;

@Getter
@Setter
@ConfigurationProperties(prefix = "feed.ranking")
public class FeedRankingProperties {

    private ScoringPolicyType policy = ScoringPolicyType.WEIGHTED_LINEAR;

    // WEIGHTED_LINEAR
    private double commentWeight = 1.2;
    private double recencyWeight = 0.8;
    private double relevanceMatchScore = 1.5;
    private double relevanceMissScore = 1.0;

    // KEYWORD_FREQUENCY
    private double keywordCommentWeight = 2.0;
}
