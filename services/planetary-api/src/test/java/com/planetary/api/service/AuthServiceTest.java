package com.planetary.api.service;

import com.planetary.api.dto.LoginResponse;
import com.planetary.api.dto.RegistrationRequest;
import com.planetary.api.entity.User;
import com.planetary.api.exception.InvalidCredentialsException;
import com.planetary.api.exception.ResourceConflictException;
import com.planetary.api.repository.UserRepository;
import com.planetary.api.security.JwtUtil;
import com.planetary.api.security.TokenIdentity;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.InjectMocks;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.time.Instant;
import java.util.Optional;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.BDDMockito.given;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;

@ExtendWith(MockitoExtension.class)
@DisplayName("AuthService unit tests")
class AuthServiceTest {

    private static final String TEST_EMAIL = "ana@earth.com";
    private static final String TEST_PASSWORD = "stardust";

    @Mock
    private UserRepository userRepository;
    @Mock
    private JwtUtil jwtUtil;
    @Mock
    private PasswordRecoveryMailer passwordRecoveryMailer;
    @InjectMocks
    private AuthService authService;

    private User testUser;

    @BeforeEach
    void setUp() {
        testUser = User.builder()
                .id(1)
                .firstname("Ana")
                .lastname("Lopez")
                .email(TEST_EMAIL)
                .password(TEST_PASSWORD)
                .build();
    }

    @Test
    @DisplayName("register stores the user exactly as submitted")
    void register_Success() {
        // given
        RegistrationRequest request = new RegistrationRequest("Ana", "Lopez", TEST_EMAIL, TEST_PASSWORD);
        given(userRepository.existsByEmail(TEST_EMAIL)).willReturn(false);
        given(userRepository.save(any(User.class))).willReturn(testUser);

        // when
        User result = authService.register(request);

        // then
        ArgumentCaptor<User> captor = ArgumentCaptor.forClass(User.class);
        verify(userRepository).save(captor.capture());
        assertThat(captor.getValue().getId()).isNull();
        assertThat(captor.getValue().getFirstname()).isEqualTo("Ana");
        assertThat(captor.getValue().getLastname()).isEqualTo("Lopez");
        assertThat(captor.getValue().getEmail()).isEqualTo(TEST_EMAIL);
        assertThat(captor.getValue().getPassword()).isEqualTo(TEST_PASSWORD);
        assertThat(result.getId()).isEqualTo(1);
    }

    @Test
    @DisplayName("register rejects an email that is already taken")
    void register_DuplicateEmail() {
        // given
        RegistrationRequest request = new RegistrationRequest("Ana", "Lopez", TEST_EMAIL, TEST_PASSWORD);
        given(userRepository.existsByEmail(TEST_EMAIL)).willReturn(true);

        // when & then
        assertThatThrownBy(() -> authService.register(request))
                .isInstanceOf(ResourceConflictException.class)
                .hasMessage("That email already exists.");
        verify(userRepository, never()).save(any(User.class));
    }

    @Test
    @DisplayName("login issues a token for a matching email and password")
    void login_Success() {
        // given
        Instant expiration = Instant.now().plusSeconds(900);
        given(userRepository.findByEmailAndPassword(TEST_EMAIL, TEST_PASSWORD)).willReturn(Optional.of(testUser));
        given(jwtUtil.generateToken(TEST_EMAIL)).willReturn("signed.jwt.token");
        given(jwtUtil.verify("signed.jwt.token")).willReturn(new TokenIdentity(TEST_EMAIL, expiration));

        // when
        LoginResponse response = authService.login(TEST_EMAIL, TEST_PASSWORD);

        // then
        assertThat(response.getMessage()).isEqualTo("Login succeeded!");
        assertThat(response.getAccessToken()).isEqualTo("signed.jwt.token");
        assertThat(response.getExpiresAt()).isEqualTo(expiration);
    }

    @Test
    @DisplayName("login with a wrong password issues no token")
    void login_BadCredentials() {
        // given
        given(userRepository.findByEmailAndPassword(TEST_EMAIL, "wrong")).willReturn(Optional.empty());

        // when & then
        assertThatThrownBy(() -> authService.login(TEST_EMAIL, "wrong"))
                .isInstanceOf(InvalidCredentialsException.class)
                .hasMessage("Bad email or password");
        verify(jwtUtil, never()).generateToken(anyString());
    }

    @Test
    @DisplayName("retrievePassword mails the stored password to the owner")
    void retrievePassword_Success() {
        // given
        given(userRepository.findByEmail(TEST_EMAIL)).willReturn(Optional.of(testUser));

        // when
        authService.retrievePassword(TEST_EMAIL);

        // then
        verify(passwordRecoveryMailer).sendPasswordRecovery(TEST_EMAIL, TEST_PASSWORD);
    }

    @Test
    @DisplayName("retrievePassword for an unknown email sends nothing")
    void retrievePassword_UnknownEmail() {
        // given
        given(userRepository.findByEmail("nobody@earth.com")).willReturn(Optional.empty());

        // when & then
        assertThatThrownBy(() -> authService.retrievePassword("nobody@earth.com"))
                .isInstanceOf(InvalidCredentialsException.class)
                .hasMessage("That email doesn't exist");
        verify(passwordRecoveryMailer, never()).sendPasswordRecovery(anyString(), anyString());
    }
}
