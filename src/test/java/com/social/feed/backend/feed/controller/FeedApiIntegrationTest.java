package com.social.feed.backend.feed.controller;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.AutoConfigureMockMvc;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.http.MediaType;
import org.springframework.test.web.servlet.MockMvc;

import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

/**
 * 기동 시 시드 데이터(유저 0..9, 게시글 0..4, 댓글 0..9) 기준 시나리오.
 * 테스트끼리 캐시 키와 id가 겹치지 않게 유저/게시글 id를 나눠 쓴다.
 */
@SpringBootTest
@AutoConfigureMockMvc
class FeedApiIntegrationTest {

    @Autowired MockMvc mockMvc;
    @Autowired ObjectMapper objectMapper;

    private JsonNode getJson(String url) throws Exception {
        String body = mockMvc.perform(get(url))
                .andExpect(status().isOk())
                .andReturn().getResponse().getContentAsString(StandardCharsets.UTF_8);
        return objectMapper.readTree(body);
    }

    private void postJson(String url, String json, int expectedStatus) throws Exception {
        mockMvc.perform(post(url).contentType(MediaType.APPLICATION_JSON).content(json))
                .andExpect(status().is(expectedStatus));
    }

    private static List<Long> ids(JsonNode feed) {
        List<Long> ids = new ArrayList<>();
        feed.forEach(n -> ids.add(n.get("id").asLong()));
        return ids;
    }

    @Test
    void seeded_user_zero_sees_own_post_with_relevance_and_comments() throws Exception {
        JsonNode res = getJson("/feed?user_id=0");
        JsonNode feed = res.get("feed");

        JsonNode post0 = null;
        for (JsonNode n : feed) {
            if (n.get("id").asLong() == 0L) post0 = n;
        }

        assertNotNull(post0, "post 0 must be in user 0 feed");
        assertEquals(1.5, post0.get("relevance_score").asDouble());
        assertEquals(2, post0.get("comments_count").asLong());
        assertEquals(0L, post0.get("user_id").asLong());
        assertTrue(res.has("start_after_id"));
        assertFalse(res.has("done"));
    }

    @Test
    void feed_is_sorted_by_score_descending() throws Exception {
        postJson("/users", "{\"id\": 60, \"name\": \"Sorter\"}", 201);

        JsonNode feed = getJson("/feed?user_id=60&batch_size=50").get("feed");

        assertTrue(feed.size() >= 5);
        for (int i = 1; i < feed.size(); i++) {
            assertTrue(feed.get(i - 1).get("score").asDouble() >= feed.get(i).get("score").asDouble());
        }
    }

    @Test
    void user_without_interactions_gets_unfiltered_candidates() throws Exception {
        postJson("/users", "{\"id\": 50, \"name\": \"Newbie\"}", 201);

        JsonNode feed = getJson("/feed?user_id=50").get("feed");

        assertTrue(ids(feed).containsAll(List.of(0L, 1L, 2L, 3L, 4L)));
    }

    @Test
    void cursor_present_iff_feed_non_empty() throws Exception {
        postJson("/users", "{\"id\": 51, \"name\": \"Pager\"}", 201);

        JsonNode page = getJson("/feed?user_id=51&batch_size=2");
        assertEquals(2, page.get("feed").size());
        assertEquals(ids(page.get("feed")).get(1), page.get("start_after_id").asLong());
        assertFalse(page.has("done"));

        JsonNode end = getJson("/feed?user_id=51&start_after_id=100000");
        assertEquals(0, end.get("feed").size());
        assertFalse(end.has("start_after_id"));
        assertTrue(end.get("done").asBoolean());
    }

    @Test
    void repeated_request_is_served_from_cache_even_after_new_post() throws Exception {
        String url = "/feed?user_id=3&batch_size=10";
        String first = mockMvc.perform(get(url)).andExpect(status().isOk())
                .andReturn().getResponse().getContentAsString();

        // 유저 3의 관심사("Post content 3")에 매칭되는 새 글. 작성자는 다른 유저 (3의 프로필은 그대로)
        postJson("/posts", "{\"id\": 103, \"user_id\": 4, \"content\": \"Post content 3 again\"}", 201);

        String second = mockMvc.perform(get(url)).andExpect(status().isOk())
                .andReturn().getResponse().getContentAsString();
        assertEquals(first, second);

        // 다른 키로 요청하면 새 글이 보인다 (데이터는 실제로 바뀌었음)
        JsonNode fresh = getJson("/feed?user_id=3&batch_size=11");
        assertTrue(ids(fresh.get("feed")).contains(103L));
    }

    @Test
    void missing_user_id_is_bad_request() throws Exception {
        mockMvc.perform(get("/feed"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.error").value("User ID is required"));
    }

    @Test
    void malformed_batch_size_is_bad_request() throws Exception {
        mockMvc.perform(get("/feed?user_id=1&batch_size=abc"))
                .andExpect(status().isBadRequest());
        mockMvc.perform(get("/feed?user_id=1&batch_size=0"))
                .andExpect(status().isBadRequest());
    }

    @Test
    void unknown_post_is_404() throws Exception {
        mockMvc.perform(get("/posts/999"))
                .andExpect(status().isNotFound())
                .andExpect(jsonPath("$.error").value("Post not found"));
    }

    @Test
    void seeded_post_comes_with_its_comments() throws Exception {
        JsonNode res = getJson("/posts/1");

        assertEquals("Post content 1", res.get("post").get("content").asText());
        // 댓글 1, 6 (i % 5 == 1)
        assertEquals(List.of(1L, 6L), ids(res.get("comments")));
    }

    @Test
    void post_for_unknown_user_is_404() throws Exception {
        mockMvc.perform(post("/posts").contentType(MediaType.APPLICATION_JSON)
                        .content("{\"id\": 200, \"user_id\": 777, \"content\": \"hi\"}"))
                .andExpect(status().isNotFound())
                .andExpect(jsonPath("$.error").value("User not found"));
    }

    @Test
    void create_endpoints_validate_and_report_conflicts() throws Exception {
        mockMvc.perform(post("/users").contentType(MediaType.APPLICATION_JSON).content("{\"id\": 70}"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.error").value("ID and name are required"));

        mockMvc.perform(post("/users").contentType(MediaType.APPLICATION_JSON).content("{\"id\": \"abc\", \"name\": \"x\"}"))
                .andExpect(status().isBadRequest());

        mockMvc.perform(post("/users").contentType(MediaType.APPLICATION_JSON).content("{\"id\": 71, \"name\": \"Carol\"}"))
                .andExpect(status().isCreated())
                .andExpect(jsonPath("$.message").value("User added successfully"));

        mockMvc.perform(post("/users").contentType(MediaType.APPLICATION_JSON).content("{\"id\": 71, \"name\": \"Dup\"}"))
                .andExpect(status().isConflict());

        mockMvc.perform(get("/users/71"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.name").value("Carol"));

        mockMvc.perform(post("/comments").contentType(MediaType.APPLICATION_JSON)
                        .content("{\"id\": 300, \"post_id\": 2, \"user_id\": 71, \"content\": \"hello\"}"))
                .andExpect(status().isCreated())
                .andExpect(jsonPath("$.message").value("Comment created successfully"));

        mockMvc.perform(post("/comments").contentType(MediaType.APPLICATION_JSON)
                        .content("{\"id\": 301, \"post_id\": 2, \"user_id\": 71}"))
                .andExpect(status().isBadRequest());
    }

    @Test
    void every_endpoint_has_an_api_summary() throws Exception {
        JsonNode paths = getJson("/v3/api-docs").get("paths");

        assertEquals("유저 조회", paths.at("/~1users~1{id}/get/summary").asText());
        assertEquals("댓글 작성", paths.at("/~1comments/post/summary").asText());

        List<String> missing = new ArrayList<>();
        paths.fields().forEachRemaining(path -> path.getValue().fields().forEachRemaining(op -> {
            if (!op.getValue().hasNonNull("summary")) missing.add(op.getKey() + " " + path.getKey());
        }));
        assertTrue(missing.isEmpty(), "operations without summary: " + missing);
    }
}
