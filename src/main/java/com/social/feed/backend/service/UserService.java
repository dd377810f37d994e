package com.social.feed.backend.service;

import com.social.feed.backend.exception.BadRequestException;
import com.social.feed.backend.exception.ResourceAlreadyInUseException;
import com.social.feed.backend.exception.ResourceNotFoundException;
import com.social.feed.backend.exception.StoreException;
import com.social.feed.backend.model.User;
import com.social.feed.backend.model.payload.request.CreateUserRequest;
import com.social.feed.backend.model.payload.response.UserResponse;
import com.social.feed.backend.repository.UserRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataAccessException;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;
import org.springframework.util.StringUtils;

@Slf4j
@Service
@RequiredArgsConstructor
public class UserService {

    private final UserRepository userRepository;

    /**
     * 같은 id가 이미 있으면 덮어쓰지 않고 409.
     */
    @Transactional
    public Long create(CreateUserRequest req) {
        validate(req);

        try {
            if (userRepository.existsById(req.getId())) {
                throw new ResourceAlreadyInUseException("User", req.getId());
            }
            userRepository.saveAndFlush(User.of(req.getId(), req.getName()));
        } catch (DataAccessException e) {
            throw new StoreException("Failed to add user", e);
        }

        log.info("user created id={}", req.getId());
        return req.getId();
    }

    @Transactional(readOnly = true)
    public UserResponse getUser(Long id) {
        User user;
        try {
            user = userRepository.findById(id).orElse(null);
        } catch (DataAccessException e) {
            throw new StoreException("Failed to fetch user", e);
        }
        if (user == null) throw new ResourceNotFoundException("User", id);
        return UserResponse.from(user);
    }

    private void validate(CreateUserRequest req) {
        if (req == null || req.getId() == null || !StringUtils.hasText(req.getName())) {
            throw new BadRequestException("ID and name are required");
        }
    }
}
