package com.planetary.api.dto;

import jakarta.validation.constraints.NotBlank;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * LoginRequest - Data Transfer Object for email/password login requests.
 *
 * Bound either from a JSON body or from form fields of the same names:
 * <pre>
 * POST /login
 * Content-Type: application/json
 *
 * {
 *   "email": "user@example.com",
 *   "password": "secret"
 * }
 * </pre>
 *
 * Security Note:
 * Never log the password field.
 *
 * @see com.planetary.api.controller.AuthController for endpoint handling
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
public class LoginRequest {

    @NotBlank
    private String email;

    @NotBlank
    private String password;
}
