package com.planetary.api.security;

import java.time.Instant;

/**
 * Identity carried by a verified access token.
 *
 * @param subject   email of the user the token was issued to
 * @param expiresAt the token's exp claim
 */
public record TokenIdentity(String subject, Instant expiresAt) {
}
