package com.foodgram.backend.service;

import com.foodgram.backend.domain.dto.user.AvatarDto;
import com.foodgram.backend.domain.dto.user.SetPasswordRequestDto;
import com.foodgram.backend.domain.dto.user.UserCreateRequestDto;
import com.foodgram.backend.domain.dto.user.UserCreatedDto;
import com.foodgram.backend.domain.entity.User;
import com.foodgram.backend.domain.repository.SubscriptionRepository;
import com.foodgram.backend.domain.repository.UserRepository;
import com.foodgram.backend.exception.ErrorCode;
import com.foodgram.backend.exception.RequestValidationException;
import com.foodgram.backend.service.image.ImageService;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.InjectMocks;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.security.crypto.password.PasswordEncoder;

import java.util.Optional;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class UserServiceTest {

    @Mock
    private UserRepository userRepository;
    @Mock
    private SubscriptionRepository subscriptionRepository;
    @Mock
    private PasswordEncoder passwordEncoder;
    @Mock
    private ImageService imageService;

    @InjectMocks
    private UserService userService;

    private UserCreateRequestDto request;

    @BeforeEach
    void setUp() {
        request = UserCreateRequestDto.builder()
                .email("cook@example.com")
                .username("cook")
                .firstName("Ann")
                .lastName("Cook")
                .password("s3cret-pass")
                .build();
    }

    @Test
    @DisplayName("register: stores an encoded password and returns the public fields")
    void register_success() {
        when(userRepository.existsByEmail("cook@example.com")).thenReturn(false);
        when(userRepository.existsByUsername("cook")).thenReturn(false);
        when(passwordEncoder.encode("s3cret-pass")).thenReturn("{bcrypt}hash");
        when(userRepository.save(any(User.class))).thenAnswer(inv -> {
            User u = inv.getArgument(0);
            assertThat(u.getPassword()).isEqualTo("{bcrypt}hash");
            return User.builder().id(7L).email(u.getEmail()).username(u.getUsername())
                    .firstName(u.getFirstName()).lastName(u.getLastName()).password(u.getPassword()).build();
        });

        UserCreatedDto created = userService.register(request);

        assertThat(created.getId()).isEqualTo(7L);
        assertThat(created.getUsername()).isEqualTo("cook");
        assertThat(created.getFirstName()).isEqualTo("Ann");
    }

    @Test
    @DisplayName("register: the username 'me' is reserved")
    void register_reservedUsername_throws() {
        request.setUsername("me");

        assertThatThrownBy(() -> userService.register(request))
                .isInstanceOf(RequestValidationException.class)
                .satisfies(e -> assertThat(((RequestValidationException) e).getFieldErrors()).containsKey("username"));
        verifyNoInteractions(userRepository);
    }

    @Test
    @DisplayName("register: a taken email is reported on the email field")
    void register_duplicateEmail_throws() {
        when(userRepository.existsByEmail("cook@example.com")).thenReturn(true);

        assertThatThrownBy(() -> userService.register(request))
                .isInstanceOf(RequestValidationException.class)
                .satisfies(e -> {
                    RequestValidationException ex = (RequestValidationException) e;
                    assertThat(ex.getErrorCode()).isEqualTo(ErrorCode.DUPLICATE_EMAIL);
                    assertThat(ex.getFieldErrors()).containsKey("email");
                });
        verify(userRepository, never()).save(any());
    }

    @Test
    @DisplayName("setPassword: a wrong current password is rejected")
    void setPassword_wrongCurrent_throws() {
        User user = User.builder().id(1L).password("stored").build();
        when(userRepository.findById(1L)).thenReturn(Optional.of(user));
        when(passwordEncoder.matches("wrong", "stored")).thenReturn(false);

        assertThatThrownBy(() -> userService.setPassword(1L, new SetPasswordRequestDto("new-pass", "wrong")))
                .isInstanceOf(RequestValidationException.class)
                .extracting(e -> ((RequestValidationException) e).getErrorCode())
                .isEqualTo(ErrorCode.INVALID_CURRENT_PASSWORD);
        assertThat(user.getPassword()).isEqualTo("stored");
    }

    @Test
    @DisplayName("setPassword: stores the new encoded password")
    void setPassword_success() {
        User user = User.builder().id(1L).password("stored").build();
        when(userRepository.findById(1L)).thenReturn(Optional.of(user));
        when(passwordEncoder.matches("old", "stored")).thenReturn(true);
        when(passwordEncoder.encode("new-pass")).thenReturn("encoded-new");

        userService.setPassword(1L, new SetPasswordRequestDto("new-pass", "old"));

        assertThat(user.getPassword()).isEqualTo("encoded-new");
    }

    @Test
    @DisplayName("updateAvatar: neither file nor data URI gives AVATAR_REQUIRED")
    void updateAvatar_missing_throws() {
        when(userRepository.findById(1L)).thenReturn(Optional.of(User.builder().id(1L).build()));

        assertThatThrownBy(() -> userService.updateAvatar(1L, "  ", null))
                .isInstanceOf(RequestValidationException.class)
                .extracting(e -> ((RequestValidationException) e).getErrorCode())
                .isEqualTo(ErrorCode.AVATAR_REQUIRED);
        verifyNoInteractions(imageService);
    }

    @Test
    @DisplayName("updateAvatar: replaces the key, deletes the old file and returns the URL")
    void updateAvatar_replacesOldImage() {
        User user = User.builder().id(1L).avatarKey("avatars/old.png").build();
        when(userRepository.findById(1L)).thenReturn(Optional.of(user));
        when(imageService.storeDataUri("data:image/png;base64,AAAA", ImageService.AVATAR_DIRECTORY, "avatar"))
                .thenReturn("avatars/new.png");
        when(imageService.toUrl("avatars/new.png")).thenReturn("http://media/avatars/new.png");

        AvatarDto dto = userService.updateAvatar(1L, "data:image/png;base64,AAAA", null);

        assertThat(dto.getAvatar()).isEqualTo("http://media/avatars/new.png");
        assertThat(user.getAvatarKey()).isEqualTo("avatars/new.png");
        verify(imageService).discardOnRollback("avatars/new.png");
        verify(imageService).deleteAfterCommit("avatars/old.png");
    }
}
