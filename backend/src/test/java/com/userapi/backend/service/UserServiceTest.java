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
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mapstruct.factory.Mappers;
import org.mockito.InjectMocks;
import org.mockito.Mock;
import org.mockito.Spy;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.data.domain.Sort;

import java.util.List;
import java.util.Optional;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class UserServiceTest {

    @Mock private UserRepository userRepository;
    @Spy private UserMapper userMapper = Mappers.getMapper(UserMapper.class);

    @InjectMocks private UserService service;

    @Test
    void listUsersMapsEveryRecordInIdOrder() {
        when(userRepository.findAll(Sort.by("id")))
                .thenReturn(List.of(user(1L, "a@b.com", "A"), user(2L, "c@d.com", "C")));

        List<UserResponse> users = service.listUsers();

        assertThat(users).extracting(UserResponse::id).containsExactly(1L, 2L);
        assertThat(users).extracting(UserResponse::email).containsExactly("a@b.com", "c@d.com");
    }

    @Test
    void getUserThrowsWhenNotFound() {
        when(userRepository.findById(999L)).thenReturn(Optional.empty());

        assertThatThrownBy(() -> service.getUser(999L))
                .isInstanceOf(UserNotFoundException.class)
                .hasMessage("user not found");
    }

    @Test
    void updateAndDeleteOfMissingUserAreNotFound() {
        when(userRepository.findById(999L)).thenReturn(Optional.empty());

        assertThatThrownBy(() -> service.updateUser(999L, new UpdateUserRequest("x", null)))
                .isInstanceOf(UserNotFoundException.class);
        assertThatThrownBy(() -> service.deleteUser(999L))
                .isInstanceOf(UserNotFoundException.class);
        verify(userRepository, never()).delete(any());
    }

    @Test
    void updateOverwritesOnlySuppliedFields() {
        User stored = user(1L, "a@b.com", "A");
        when(userRepository.findById(1L)).thenReturn(Optional.of(stored));
        when(userRepository.saveAndFlush(stored)).thenReturn(stored);

        UserResponse updated = service.updateUser(1L, new UpdateUserRequest("Alice", ""));

        assertThat(updated.name()).isEqualTo("Alice");
        assertThat(updated.email()).isEqualTo("a@b.com");
    }

    @Test
    void updateNormalizesAndAppliesNewEmail() {
        User stored = user(1L, "a@b.com", "A");
        when(userRepository.findById(1L)).thenReturn(Optional.of(stored));
        when(userRepository.existsByEmailAndIdNot("new@b.com", 1L)).thenReturn(false);
        when(userRepository.saveAndFlush(stored)).thenReturn(stored);

        UserResponse updated = service.updateUser(1L, new UpdateUserRequest(null, "New@B.com"));

        assertThat(updated.email()).isEqualTo("new@b.com");
        assertThat(updated.name()).isEqualTo("A");
    }

    @Test
    void updateRejectsEmailOwnedByAnotherUser() {
        User stored = user(1L, "a@b.com", "A");
        when(userRepository.findById(1L)).thenReturn(Optional.of(stored));
        when(userRepository.existsByEmailAndIdNot("taken@b.com", 1L)).thenReturn(true);

        assertThatThrownBy(() -> service.updateUser(1L, new UpdateUserRequest(null, "taken@b.com")))
                .isInstanceOf(EmailAlreadyRegisteredException.class);
        assertThat(stored.getEmail()).isEqualTo("a@b.com");
        verify(userRepository, never()).saveAndFlush(any());
    }

    @Test
    void updateTurnsUniqueConstraintViolationIntoConflict() {
        User stored = user(1L, "a@b.com", "A");
        when(userRepository.findById(1L)).thenReturn(Optional.of(stored));
        when(userRepository.existsByEmailAndIdNot("new@b.com", 1L)).thenReturn(false);
        when(userRepository.saveAndFlush(stored))
                .thenThrow(new DataIntegrityViolationException("constraint [uk_users_email]"));

        assertThatThrownBy(() -> service.updateUser(1L, new UpdateUserRequest(null, "new@b.com")))
                .isInstanceOf(EmailAlreadyRegisteredException.class);
    }

    @Test
    void updateLetsOtherIntegrityErrorsThrough() {
        User stored = user(1L, "a@b.com", "A");
        when(userRepository.findById(1L)).thenReturn(Optional.of(stored));
        DataIntegrityViolationException notNull = new DataIntegrityViolationException("NULL not allowed for column \"NAME\"");
        when(userRepository.saveAndFlush(stored)).thenThrow(notNull);

        assertThatThrownBy(() -> service.updateUser(1L, new UpdateUserRequest("B", null)))
                .isSameAs(notNull);
    }

    @Test
    void deleteRemovesExistingUser() {
        User stored = user(3L, "a@b.com", "A");
        when(userRepository.findById(3L)).thenReturn(Optional.of(stored));

        service.deleteUser(3L);

        verify(userRepository).delete(stored);
    }

    @Test
    void profileResolvesCallerFromToken() {
        when(userRepository.findById(5L)).thenReturn(Optional.of(user(5L, "me@b.com", "Me")));

        UserSummary profile = service.getProfile(new AuthenticatedUser(5L, "me@b.com", "user"));

        assertThat(profile).isEqualTo(new UserSummary(5L, "me@b.com", "Me", "user"));
    }

    @Test
    void profileOfDeletedCallerIsNotFound() {
        when(userRepository.findById(5L)).thenReturn(Optional.empty());

        assertThatThrownBy(() -> service.getProfile(new AuthenticatedUser(5L, "me@b.com", "user")))
                .isInstanceOf(UserNotFoundException.class);
    }

    private static User user(Long id, String email, String name) {
        User user = new User();
        user.setId(id);
        user.setEmail(email);
        user.setName(name);
        user.setPasswordHash("$2a$10$hash");
        return user;
    }
}
