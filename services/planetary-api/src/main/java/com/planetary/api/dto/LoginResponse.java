package com.planetary.api.dto;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;

/**
 * LoginResponse - returned after a successful login.
 *
 * Example Response:
 * <pre>
 * {
 *   "message": "Login succeeded!",
 *   "access_token": "eyJhbGciOiJIUzI1NiJ9...",
 *   "expires_at": "2024-01-15T10:30:00Z"
 * }
 * </pre>
 *
 * The token goes into the Authorization header of later calls:
 * {@code Authorization: Bearer <access_token>}.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public class LoginResponse {

    private String message;

    private String accessToken;

    /**
     * Matches the token's exp claim (15 minutes after issue by default).
     */
    private Instant expiresAt;
}
