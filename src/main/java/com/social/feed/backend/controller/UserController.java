package com.social.feed.backend.controller;

import com.social.feed.backend.model.payload.request.CreateUserRequest;
import com.social.feed.backend.model.payload.response.MessageResponse;
import com.social.feed.backend.model.payload.response.UserResponse;
import com.social.feed.backend.service.UserService;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.tags.Tag;
import lombok.RequiredArgsConstructor;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

@RestController
@RequiredArgsConstructor
@RequestMapping("/users")
@Tag(name = "users")
public class UserController {

    private final UserService userService;

    @Operation(summary = "유저 생성")
    @PostMapping
    public ResponseEntity<MessageResponse> create(@RequestBody(required = false) CreateUserRequest req) {
        userService.create(req);
        return ResponseEntity
                .status(HttpStatus.CREATED)
                .body(new MessageResponse("User added successfully"));
    }

    @Operation(summary = "유저 조회")
    @GetMapping("/{id}")
    public UserResponse get(@PathVariable Long id) {
        return userService.getUser(id);
    }
}
