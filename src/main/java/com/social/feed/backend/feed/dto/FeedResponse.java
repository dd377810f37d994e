package com.social.feed.backend.feed.dto;

import com.fasterxml.jackson.annotation.JsonInclude;

import java.util.List;

/**
 * 피드 응답 = 캐시 저장 단위.
 * - feed가 비어있지 않으면: startAfterId(다음 커서) 존재, done 없음
 * - feed가 비어있으면: startAfterId 없음, done = true
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record FeedResponse(
        List<FeedItemResponse> feed,
        Long startAfterId,
        Boolean done
) {
    public static FeedResponse page(List<FeedItemResponse> feed) {
        if (feed == null || feed.isEmpty()) {
            return exhausted();
        }
        // 다음 커서 = 랭킹 후 마지막 항목의 id
        Long nextCursor = feed.get(feed.size() - 1).id();
        return new FeedResponse(List.copyOf(feed), nextCursor, null);
    }

    public static FeedResponse exhausted() {
        return new FeedResponse(List.of(), null, Boolean.TRUE);
    }
}
