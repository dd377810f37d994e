package com.social.feed.backend.feed.service;

import com.social.feed.backend.feed.vo.InterestProfile;
import com.social.feed.backend.model.Post;
import com.social.feed.backend.repository.PostRepository;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

@Component
@RequiredArgsConstructor
public class InterestProfileBuilder {

    private final PostRepository postRepository;

    /**
     * 유저가 작성했거나 댓글을 단 게시글 content로 관심사 프로필 생성.
     * 존재하지 않는 유저는 빈 프로필.
     */
    public InterestProfile buildProfile(Long userId) {
        List<Post> interacted = postRepository.findInteractedByUserId(userId);
        if (interacted.isEmpty()) {
            return InterestProfile.empty();
        }

        // 같은 content는 한 번만
        Set<String> contents = new LinkedHashSet<>();
        for (Post p : interacted) {
            contents.add(p.getContent());
        }

        String filterText = String.join(" ", contents);
        return new InterestProfile(filterText, countTokens(filterText));
    }

    static Map<String, Integer> countTokens(String text) {
        Map<String, Integer> weights = new LinkedHashMap<>();
        if (text == null || text.isBlank()) return weights;

        for (String raw : text.split("\\s+")) {
            String token = raw.trim();
            if (token.isEmpty()) continue;
            weights.merge(token, 1, Integer::sum);
        }
        return weights;
    }
}
