package com.social.feed.backend.feed.service;

import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.stats.CacheStats;
import com.social.feed.backend.feed.dto.FeedResponse;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Component;

import java.util.Optional;

/**
 * 피드 응답 메모이제이션 (프로세스 수명 동안 유지).
 * - 크기 제한 X, TTL X, 쓰기(게시글/댓글 생성)로 무효화 X
 * - 같은 키에 대한 동시 miss는 둘 다 계산하고 마지막 put이 남는다
 */
@Component
public class FeedResponseCache {

    private final Cache<String, FeedResponse> cache;

    public FeedResponseCache(@Qualifier("feedResponseStore") Cache<String, FeedResponse> cache) {
        this.cache = cache;
    }

    public Optional<FeedResponse> get(String key) {
        return Optional.ofNullable(cache.getIfPresent(key));
    }

    public void put(String key, FeedResponse response) {
        cache.put(key, response);
    }

    public long size() {
        return cache.estimatedSize();
    }

    public CacheStats stats() {
        return cache.stats();
    }
}
