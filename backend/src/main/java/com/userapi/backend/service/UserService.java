package com.userapi.backend.service;

import com.userapi.backend.dto.UpdateUserRequest;
import com.userapi.backend.dto.UserResponse;
import com.userapi.backend.dto.UserSummary;
import com.userapi.backend.entity.User;
import com.userapi.backend.exception.EmailAlreadyRegisteredException;
import com.userapi.backend.exception.UserNotFoundException;
import com.userapi.backend.mapper.UserMapper;
import com.userapi.backend.repository.UserRepository;
import com.userapi.backend.security.AuthenticatedUser;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.data.domain.Sort;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.util.List;

@Slf4j
@Service
@RequiredArgsConstructor
public class UserService {

    private final UserRepository userRepository;
    private final UserMapper userMapper;

    @Transactional(readOnly = true)
    public List<UserResponse> listUsers() {
        return userMapper.toResponses(userRepository.findAll(Sort.by("id")));
    }

    @Transactional(readOnly = true)
    public UserResponse getUser(Long id) {
        return userMapper.toResponse(load(id));
    }

    @Transactional
    public UserResponse updateUser(Long id, UpdateUserRequest request) {
        User user = load(id);

        if (hasText(request.getName())) {
            user.setName(request.getName().trim());
        }
        if (hasText(request.getEmail())) {
            String email = Emails.normalize(request.getEmail());
            if (!email.equals(user.getEmail()) && userRepository.existsByEmailAndIdNot(email, id)) {
                throw new EmailAlreadyRegisteredException();
            }
            user.setEmail(email);
        }

        User saved;
        try {
            saved = userRepository.saveAndFlush(user);
        } catch (DataIntegrityViolationException e) {
            if (!UniqueEmailViolation.isCauseOf(e)) {
                throw e;
            }
            throw new EmailAlreadyRegisteredException(e);
        }
        log.info("updated user id={}", id);
        return userMapper.toResponse(saved);
    }

    @Transactional
    public void deleteUser(Long id) {
        User user = load(id);
        userRepository.delete(user);
        log.info("deleted user id={}", id);
    }

    /**
     * Profile of the caller named by the verified token. A token can outlive its
     * user, so a deleted account yields not-found.
     */
    @Transactional(readOnly = true)
    public UserSummary getProfile(AuthenticatedUser caller) {
        return userMapper.toSummary(load(caller.userId()));
    }

    private User load(Long id) {
        return userRepository.findById(id)
                .orElseThrow(() -> new UserNotFoundException(id));
    }

    private static boolean hasText(String value) {
        return value != null && !value.isBlank();
    }
}
