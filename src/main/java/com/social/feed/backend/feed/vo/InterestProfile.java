package com.social.feed.backend.feed.vo;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * 유저 관심사 프로필 (요청마다 새로 계산, 저장 X).
 *
 * @param filterText     상호작용한 게시글 content를 공백 하나로 이어붙인 문자열 (LIKE 필터 원천)
 * @param keywordWeights 토큰 → 등장 횟수
 */
public record InterestProfile(
        String filterText,
        Map<String, Integer> keywordWeights
) {
    private static final InterestProfile EMPTY = new InterestProfile("", Map.of());

    public InterestProfile {
        filterText = filterText == null ? "" : filterText;
        keywordWeights = keywordWeights == null
                ? Map.of()
                : Collections.unmodifiableMap(new LinkedHashMap<>(keywordWeights));
    }

    public static InterestProfile empty() {
        return EMPTY;
    }

    public boolean isEmpty() {
        return filterText.isEmpty();
    }

    /**
     * SQL LIKE 패턴. 빈 프로필이면 "%%" (= 모든 content 매칭).
     */
    public String likePattern() {
        return "%" + filterText + "%";
    }

    public int weightOf(String token) {
        return keywordWeights.getOrDefault(token, 0);
    }
}
