package com.social.feed.backend.feed.vo;

public record RankedEntry(
        Candidate candidate,
        double relevanceScore,
        double score
) {
    public Long id() {
        return candidate.id();
    }
}
