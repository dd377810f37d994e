package com.social.feed.backend.config;

import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;
import com.social.feed.backend.feed.dto.FeedResponse;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * 프로세스 내 캐시 설정.
 */
@Configuration
public class CacheConfig {

    /**
     * 피드 응답 캐시. 키 = feed:{userId}:{startAfterId|head}:{batchSize}.
     * maximumSize / expireAfterWrite 모두 지정하지 않음 (무제한, 만료 없음).
     */
    @Bean("feedResponseStore")
    public Cache<String, FeedResponse> feedResponseStore() {
        return Caffeine.newBuilder()
                .recordStats()
                .build();
    }
}
