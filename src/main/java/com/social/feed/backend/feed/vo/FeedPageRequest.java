package com.social.feed.backend.feed.vo;

/**
 * 피드 조회 파라미터. 캐시 키의 원천이기도 하다.
 *
 * @param startAfterId null이면 처음부터 (id 하한 없음)
 */
public record FeedPageRequest(
        Long userId,
        Long startAfterId,
        int batchSize
) {
    private static final String HEAD = "head";

    public long lowerBound() {
        return startAfterId == null ? Long.MIN_VALUE : startAfterId;
    }

    public String cacheKey() {
        return "feed:" + userId + ":" + (startAfterId == null ? HEAD : startAfterId) + ":" + batchSize;
    }
}
