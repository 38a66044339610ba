package com.planetary.api.controller;

import com.planetary.api.dto.LoginRequest;
import com.planetary.api.dto.LoginResponse;
import com.planetary.api.dto.MessageResponse;
import com.planetary.api.dto.RegistrationRequest;
import com.planetary.api.dto.RegistrationResponse;
import com.planetary.api.dto.UserResponse;
import com.planetary.api.entity.User;
import com.planetary.api.service.AuthService;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

/**
 * AuthController - REST endpoints for account management.
 *
 * Endpoints:
 * - POST /register: create an account from form fields
 * - POST /login: exchange email and password for an access token (JSON or form)
 * - GET /retrieve_password/{email}: mail the stored password to its owner
 *
 * All three are public; see SecurityConfig.
 */
@RestController
@RequiredArgsConstructor
public class AuthController {

    private final AuthService authService;

    /**
     * Register a new user.
     *
     * @return 201 with the created user, 409 if the email is taken
     */
    @PostMapping(value = "/register", consumes = MediaType.APPLICATION_FORM_URLENCODED_VALUE)
    public ResponseEntity<RegistrationResponse> register(@Valid @ModelAttribute RegistrationRequest request) {
        User user = authService.register(request);
        return ResponseEntity.status(HttpStatus.CREATED)
                .body(new RegistrationResponse("User created successfully.", UserResponse.from(user)));
    }

    /**
     * Login with a JSON body.
     *
     * @return 200 with the access token, 401 on mismatch
     */
    @PostMapping(value = "/login", consumes = MediaType.APPLICATION_JSON_VALUE)
    public ResponseEntity<LoginResponse> loginJson(@Valid @RequestBody LoginRequest request) {
        return ResponseEntity.ok(authService.login(request.getEmail(), request.getPassword()));
    }

    /**
     * Login with form fields email and password.
     */
    @PostMapping(value = "/login", consumes = MediaType.APPLICATION_FORM_URLENCODED_VALUE)
    public ResponseEntity<LoginResponse> loginForm(@Valid @ModelAttribute LoginRequest request) {
        return ResponseEntity.ok(authService.login(request.getEmail(), request.getPassword()));
    }

    /**
     * @return 200 once the mail is handed to the transport, 401 for an unknown email
     */
    @GetMapping("/retrieve_password/{email}")
    public ResponseEntity<MessageResponse> retrievePassword(@PathVariable String email) {
        authService.retrievePassword(email);
        return ResponseEntity.ok(new MessageResponse("Password sent to " + email));
    }
}
