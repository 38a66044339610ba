package com.planetary.api.service;

import com.planetary.api.dto.LoginResponse;
import com.planetary.api.dto.RegistrationRequest;
import com.planetary.api.entity.User;
import com.planetary.api.exception.InvalidCredentialsException;
import com.planetary.api.exception.ResourceConflictException;
import com.planetary.api.repository.UserRepository;
import com.planetary.api.security.JwtUtil;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

/**
 * AuthService - Business logic for accounts: registration, login and
 * password recovery.
 *
 * Authentication Flow:
 * 1. Client registers with firstname, lastname, email and password
 * 2. Client logs in with the same email and password
 * 3. A JWT with the email as subject is returned
 * 4. Client sends the JWT as a bearer token on planet writes
 *
 * Credentials are compared as stored strings; there is no hashing.
 *
 * @see JwtUtil for token generation
 * @see PasswordRecoveryMailer for the recovery mail
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class AuthService {

    private final UserRepository userRepository;

    private final JwtUtil jwtUtil;

    private final PasswordRecoveryMailer passwordRecoveryMailer;

    /**
     * Create a new account.
     *
     * The email check and insert are separate statements; the unique column
     * constraint catches a concurrent registration that slips between them
     * and GlobalExceptionHandler maps it to 409 as well.
     *
     * @param request registration form
     * @return the persisted user, with its generated id
     * @throws ResourceConflictException if the email is already registered
     */
    @Transactional
    public User register(RegistrationRequest request) {
        if (userRepository.existsByEmail(request.getEmail())) {
            log.info("Registration rejected, email already registered: {}", request.getEmail());
            throw new ResourceConflictException("That email already exists.");
        }

        User user = User.builder()
                .firstname(request.getFirstname())
                .lastname(request.getLastname())
                .email(request.getEmail())
                .password(request.getPassword())
                .build();
        User saved = userRepository.save(user);
        log.info("Registered user: id={}, email={}", saved.getId(), saved.getEmail());
        return saved;
    }

    /**
     * Authenticate by exact (email, password) match and issue an access token.
     *
     * @throws InvalidCredentialsException if no user matches the pair
     */
    @Transactional(readOnly = true)
    public LoginResponse login(String email, String password) {
        User user = userRepository.findByEmailAndPassword(email, password)
                .orElseThrow(() -> {
                    log.info("Login failed for email: {}", email);
                    return new InvalidCredentialsException("Bad email or password");
                });

        String token = jwtUtil.generateToken(user.getEmail());
        log.info("User authenticated successfully: {}", user.getEmail());

        return LoginResponse.builder()
                .message("Login succeeded!")
                .accessToken(token)
                .expiresAt(jwtUtil.verify(token).expiresAt())
                .build();
    }

    /**
     * Mail the stored password to the account owner.
     *
     * @throws InvalidCredentialsException if no account uses this email
     * @throws com.planetary.api.exception.MailDeliveryException if the mail transport fails
     */
    @Transactional(readOnly = true)
    public void retrievePassword(String email) {
        User user = userRepository.findByEmail(email)
                .orElseThrow(() -> new InvalidCredentialsException("That email doesn't exist"));

        passwordRecoveryMailer.sendPasswordRecovery(user.getEmail(), user.getPassword());
    }
}
