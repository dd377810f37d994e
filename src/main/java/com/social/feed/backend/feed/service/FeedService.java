package com.social.feed.backend.feed.service;

import com.social.feed.backend.exception.BadRequestException;
import com.social.feed.backend.exception.StoreException;
import com.social.feed.backend.feed.dto.FeedItemResponse;
import com.social.feed.backend.feed.dto.FeedResponse;
import com.social.feed.backend.feed.vo.Candidate;
import com.social.feed.backend.feed.vo.FeedPageRequest;
import com.social.feed.backend.feed.vo.InterestProfile;
import com.social.feed.backend.feed.vo.RankedEntry;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.dao.DataAccessException;
import org.springframework.stereotype.Service;

import java.util.List;
import java.util.Optional;

@Slf4j
@Service
@RequiredArgsConstructor
public class FeedService {

    private final InterestProfileBuilder profileBuilder;
    private final CandidateFetcher candidateFetcher;
    private final FeedRanker feedRanker;
    private final FeedResponseCache feedResponseCache;

    @Value("${feed.default-batch-size:20}")
    private int defaultBatchSize;

    @Value("${feed.max-batch-size:100}")
    private int maxBatchSize;

    /**
     * 개인화 피드 한 페이지.
     * 캐시 hit면 저장된 응답 그대로, miss면 프로필 → 후보 → 랭킹 → 커서 순으로 계산 후 저장.
     * 실패한 계산은 캐시에 남기지 않는다.
     */
    public FeedResponse getFeed(Long userId, Long startAfterId, Integer batchSize) {
        FeedPageRequest req = toPageRequest(userId, startAfterId, batchSize);
        String key = req.cacheKey();

        Optional<FeedResponse> cached = feedResponseCache.get(key);
        if (cached.isPresent()) {
            log.debug("feed cache hit key={}", key);
            return cached.get();
        }

        InterestProfile profile;
        try {
            profile = profileBuilder.buildProfile(req.userId());
        } catch (DataAccessException e) {
            throw new StoreException("Failed to fetch user interactions", e);
        }

        List<Candidate> candidates;
        try {
            candidates = candidateFetcher.fetchCandidates(profile, req.lowerBound(), req.batchSize());
        } catch (DataAccessException e) {
            throw new StoreException("Failed to fetch feed", e);
        }

        List<RankedEntry> ranked = feedRanker.rank(candidates, profile);

        FeedResponse response = FeedResponse.page(
                ranked.stream().map(FeedItemResponse::from).toList()
        );

        feedResponseCache.put(key, response);
        log.info("feed cache store key={} size={} next={} profileTokens={} cacheSize={} hitRate={}",
                key, response.feed().size(), response.startAfterId(),
                profile.keywordWeights().size(), feedResponseCache.size(), feedResponseCache.stats().hitRate());
        return response;
    }

    // 저장소 접근 전에 입력 검증
    private FeedPageRequest toPageRequest(Long userId, Long startAfterId, Integer batchSize) {
        if (userId == null) {
            throw new BadRequestException("User ID is required");
        }

        int size = (batchSize == null) ? defaultBatchSize : batchSize;
        if (size < 1 || size > maxBatchSize) {
            throw new BadRequestException("batch_size must be between 1 and " + maxBatchSize);
        }

        return new FeedPageRequest(userId, startAfterId, size);
    }
}
