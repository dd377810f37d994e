package com.social.feed.backend.config;

import com.social.feed.backend.feed.scoring.FeedScoringPolicy;
import com.social.feed.backend.feed.service.FeedRankingProperties;
import com.social.feed.backend.feed.service.FeedResponseCache;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.context.event.ApplicationReadyEvent;
import org.springframework.context.event.EventListener;
import org.springframework.stereotype.Component;

/**
 * 기동 완료 시 실제 적용된 랭킹 가중치 / 페이지 / 캐시 설정을 한 번 남긴다.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class FeedSettingsLogRunner {

    private final FeedRankingProperties rankingProperties;
    private final FeedScoringPolicy scoringPolicy;
    private final FeedResponseCache feedResponseCache;

    @Value("${feed.default-batch-size:20}")
    private int defaultBatchSize;

    @Value("${feed.max-batch-size:100}")
    private int maxBatchSize;

    @EventListener(ApplicationReadyEvent.class)
    public void logFeedSettings() {
        log.info("feed ranking {}", rankingSummary());
        log.info("feed paging defaultBatchSize={} maxBatchSize={}", defaultBatchSize, maxBatchSize);
        // 무제한/무만료 캐시라 기동 직후 크기만 의미 있음
        log.info("feed cache unbounded=true ttl=none invalidateOnWrite=false entries={}", feedResponseCache.size());
    }

    String rankingSummary() {
        FeedRankingProperties p = rankingProperties;
        return switch (scoringPolicy.type()) {
            case WEIGHTED_LINEAR -> String.format(
                    "policy=WEIGHTED_LINEAR commentWeight=%s recencyWeight=%s relevanceMatch=%s relevanceMiss=%s",
                    p.getCommentWeight(), p.getRecencyWeight(), p.getRelevanceMatchScore(), p.getRelevanceMissScore());
            case KEYWORD_FREQUENCY -> String.format(
                    "policy=KEYWORD_FREQUENCY keywordCommentWeight=%s", p.getKeywordCommentWeight());
        };
    }
}
