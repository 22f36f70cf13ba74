package com.userapi.backend.service;

import com.userapi.backend.entity.User;
import com.userapi.backend.repository.UserRepository;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.orm.jpa.DataJpaTest;
import org.springframework.dao.DataIntegrityViolationException;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.catchThrowable;

@DataJpaTest
class UniqueEmailViolationTest {

    @Autowired private UserRepository userRepository;

    @Test
    void recognisesDuplicateEmailRaisedByTheDatabase() {
        userRepository.saveAndFlush(user("a@b.com"));

        Throwable thrown = catchThrowable(() -> userRepository.saveAndFlush(user("a@b.com")));

        assertThat(thrown).isInstanceOf(DataIntegrityViolationException.class);
        assertThat(UniqueEmailViolation.isCauseOf((DataIntegrityViolationException) thrown)).isTrue();
    }

    @Test
    void ignoresValueTooLongForTheEmailColumn() {
        String email = "a".repeat(60) + "@" + ("x".repeat(60) + ".").repeat(4) + "com";

        Throwable thrown = catchThrowable(() -> userRepository.saveAndFlush(user(email)));

        assertThat(thrown).isInstanceOf(DataIntegrityViolationException.class);
        assertThat(UniqueEmailViolation.isCauseOf((DataIntegrityViolationException) thrown)).isFalse();
    }

    private static User user(String email) {
        User user = new User();
        user.setEmail(email);
        user.setName("A");
        user.setPasswordHash("$2a$10$hash");
        return user;
    }
}
