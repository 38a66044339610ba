package com.planetary.api.repository;

import com.planetary.api.entity.User;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.util.Optional;

/**
 * UserRepository - Data Access Layer for User entities.
 *
 * Spring Data JPA generates the implementation from the method names:
 * - findByEmail -> SELECT * FROM users WHERE email = ?
 * - findByEmailAndPassword -> SELECT * FROM users WHERE email = ? AND password = ?
 * - existsByEmail -> SELECT COUNT(*) > 0 FROM users WHERE email = ?
 *
 * Inserts go through the inherited save(User).
 *
 * @see com.planetary.api.service.AuthService for the business logic using this repository
 */
@Repository
public interface UserRepository extends JpaRepository<User, Integer> {

    /**
     * Find a user by their email address (case-sensitive).
     *
     * @param email The email address to search for
     * @return Optional containing the User if found, empty Optional if not
     */
    Optional<User> findByEmail(String email);

    /**
     * Find a user by an exact (email, password) pair. Used by login.
     *
     * @param email The email address
     * @param password The password exactly as the caller typed it
     * @return Optional containing the User if both fields match
     */
    Optional<User> findByEmailAndPassword(String email, String password);

    /**
     * Check if a user with the given email already exists.
     *
     * @param email The email address to check
     * @return true if a user with this email exists, false otherwise
     */
    boolean existsByEmail(String email);
}
