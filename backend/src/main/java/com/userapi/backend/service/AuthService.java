package com.userapi.backend.service;

import com.userapi.backend.dto.LoginRequest;
import com.userapi.backend.dto.LoginResponse;
import com.userapi.backend.dto.RegisterRequest;
import com.userapi.backend.dto.UserSummary;
import com.userapi.backend.entity.User;
import com.userapi.backend.exception.EmailAlreadyRegisteredException;
import com.userapi.backend.exception.InvalidCredentialsException;
import com.userapi.backend.mapper.UserMapper;
import com.userapi.backend.repository.UserRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.security.crypto.password.PasswordEncoder;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.util.Optional;

@Slf4j
@Service
@RequiredArgsConstructor
public class AuthService {

    private static final String TIMING_DUMMY_PASSWORD = "timing-dummy-password";

    private final UserRepository userRepository;
    private final PasswordEncoder passwordEncoder;
    private final JwtService jwtService;
    private final UserMapper userMapper;

    private volatile String dummyHash;

    @Transactional
    public UserSummary register(RegisterRequest request) {
        String email = Emails.normalize(request.getEmail());
        if (userRepository.existsByEmail(email)) {
            log.info("registration rejected, email already registered");
            throw new EmailAlreadyRegisteredException();
        }

        User user = new User();
        user.setEmail(email);
        user.setPasswordHash(passwordEncoder.encode(request.getPassword()));
        user.setName(request.getName().trim());
        user.setRole(User.DEFAULT_ROLE);
        user.setActive(true);

        User saved;
        try {
            // flush now so a concurrent insert of the same email fails here, not at commit
            saved = userRepository.saveAndFlush(user);
        } catch (DataIntegrityViolationException e) {
            if (!UniqueEmailViolation.isCauseOf(e)) {
                throw e;
            }
            log.info("registration lost race on unique email");
            throw new EmailAlreadyRegisteredException(e);
        }

        log.info("registered user id={}", saved.getId());
        return userMapper.toSummary(saved);
    }

    @Transactional(readOnly = true)
    public LoginResponse login(LoginRequest request) {
        Optional<User> found = userRepository.findByEmail(Emails.normalize(request.getEmail()));

        if (found.isEmpty()) {
            // burn one hash comparison so unknown emails take as long as wrong passwords
            passwordEncoder.matches(request.getPassword(), dummyHash());
            log.debug("login failed: unknown email");
            throw new InvalidCredentialsException();
        }

        User user = found.get();
        if (!passwordEncoder.matches(request.getPassword(), user.getPasswordHash())) {
            log.debug("login failed: bad password for user id={}", user.getId());
            throw new InvalidCredentialsException();
        }
        if (!user.isActive()) {
            log.info("login refused for inactive user id={}", user.getId());
            throw new InvalidCredentialsException();
        }

        String token = jwtService.generateToken(user);
        log.info("user id={} logged in", user.getId());
        return new LoginResponse(
                "login successful",
                token,
                "Bearer",
                jwtService.getExpirationSeconds(),
                userMapper.toSummary(user)
        );
    }

    private String dummyHash() {
        String hash = dummyHash;
        if (hash == null) {
            hash = passwordEncoder.encode(TIMING_DUMMY_PASSWORD);
            dummyHash = hash;
        }
        return hash;
    }
}
