package com.social.feed.backend.feed.scoring;

public enum ScoringPolicyType {
    WEIGHTED_LINEAR,    // 댓글/최신성/관련도 선형 결합 (기본)
    KEYWORD_FREQUENCY   // 키워드 빈도 합 * 최신성 감쇠
}
