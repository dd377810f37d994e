package com.social.feed.backend.feed.scoring;

import com.social.feed.backend.feed.vo.InterestProfile;

/**
 * 한 번의 랭킹 동안 공유되는 값. 관심사 LIKE 패턴은 여기서 한 번만 컴파일한다.
 */
public record ScoringContext(
        InterestProfile profile,
        LikePattern interestPattern
) {
    public static ScoringContext of(InterestProfile profile) {
        return new ScoringContext(profile, LikePattern.compile(profile.likePattern()));
    }
}
