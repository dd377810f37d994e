package com.social.feed.backend.feed.controller;

import com.social.feed.backend.feed.dto.FeedResponse;
import com.social.feed.backend.feed.service.FeedService;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.tags.Tag;
import lombok.RequiredArgsConstructor;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/feed")
@RequiredArgsConstructor
@Tag(name = "feed")
public class FeedController {

    private final FeedService feedService;

    @Operation(summary = "개인화 피드 (cursor 기반 페이지)")
    @GetMapping
    public FeedResponse feed(
            @RequestParam(name = "user_id", required = false) Long userId,
            @RequestParam(name = "batch_size", required = false) Integer batchSize,
            @RequestParam(name = "start_after_id", required = false) Long startAfterId
    ) {
        return feedService.getFeed(userId, startAfterId, batchSize);
    }
}
