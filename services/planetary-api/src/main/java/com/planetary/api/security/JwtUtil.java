package com.planetary.api.security;

import com.planetary.api.exception.InvalidTokenException;
import io.jsonwebtoken.Claims;
import io.jsonwebtoken.JwtException;
import io.jsonwebtoken.Jwts;
import io.jsonwebtoken.SignatureAlgorithm;
import io.jsonwebtoken.security.Keys;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.nio.charset.StandardCharsets;
import java.security.Key;
import java.util.Date;
import java.util.HashMap;
import java.util.Map;

/**
 * JwtUtil - Issues and verifies the bearer tokens guarding planet writes.
 *
 * Token Structure:
 * - Header: {"alg": "HS256"}
 * - Payload: {"sub": "user@example.com", "iat": 1700000000, "exp": 1700000900}
 * - Signature: HMAC-SHA256 over header and payload with the server secret
 *
 * Configuration (application.yml):
 * - jwt.secret: HMAC key, at least 32 bytes, supplied through JWT_SECRET
 * - jwt.expiration: token lifetime in milliseconds (default 900000 = 15 minutes)
 *
 * Authorization is flat: any token that verifies grants write access to every
 * planet. The subject is only informational.
 *
 * @see JwtAuthenticationFilter for per-request verification
 * @see com.planetary.api.service.AuthService#login for token issuance
 */
@Component
public class JwtUtil {

    @Value("${jwt.secret}")
    private String secret;

    @Value("${jwt.expiration}")
    private Long expiration;

    private Key getSigningKey() {
        return Keys.hmacShaKeyFor(secret.getBytes(StandardCharsets.UTF_8));
    }

    /**
     * Generate a signed token whose subject is the user's email.
     *
     * @param email The authenticated user's email
     * @return Compact JWT string (header.payload.signature)
     */
    public String generateToken(String email) {
        Map<String, Object> claims = new HashMap<>();
        return createToken(claims, email);
    }

    private String createToken(Map<String, Object> claims, String subject) {
        long now = System.currentTimeMillis();
        return Jwts.builder()
                .setClaims(claims)
                .setSubject(subject)
                .setIssuedAt(new Date(now))
                .setExpiration(new Date(now + expiration))
                .signWith(getSigningKey(), SignatureAlgorithm.HS256)
                .compact();
    }

    /**
     * Verify signature and expiry.
     *
     * @param token Compact JWT taken from the Authorization header
     * @return the identity the token was issued to
     * @throws InvalidTokenException if the token is malformed, expired or
     *         signed with a different key
     */
    public TokenIdentity verify(String token) {
        try {
            Claims claims = extractAllClaims(token);
            return new TokenIdentity(claims.getSubject(), claims.getExpiration().toInstant());
        } catch (JwtException | IllegalArgumentException e) {
            throw new InvalidTokenException("Missing or invalid access token", e);
        }
    }

    // Throws ExpiredJwtException, SignatureException, MalformedJwtException
    private Claims extractAllClaims(String token) {
        return Jwts.parserBuilder()
                .setSigningKey(getSigningKey())
                .build()
                .parseClaimsJws(token)
                .getBody();
    }
}
