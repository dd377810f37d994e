package com.social.feed.backend.feed.vo;

/**
 * 랭킹 대상 게시글 + 파생 지표.
 *
 * @param commentsCount 해당 게시글의 댓글 수 (없으면 0)
 * @param recencyScore  평가 시점 기준 게시글 나이 (일 단위, 소수)
 */
public record Candidate(
        Long id,
        Long userId,
        String content,
        String createdAt,
        long commentsCount,
        double recencyScore
) {}
