package com.planetary.api.entity;

import jakarta.persistence.*;
import lombok.*;

/**
 * User - JPA Entity representing a registered account.
 *
 * Table Schema:
 * - id: integer primary key (identity)
 * - firstname / lastname: free text
 * - email: unique, used as the login identifier and token subject
 * - password: stored exactly as supplied at registration
 *
 * Lifecycle:
 * - Created by registration (AuthService.register) or the db_seed command
 * - Read during login and password recovery
 * - Never updated or deleted by any exposed operation
 *
 * Security Note:
 * The password column holds the plaintext secret. Password recovery mails it
 * back to the owner, so it cannot be hashed without changing that contract.
 *
 * @see com.planetary.api.repository.UserRepository for database operations
 */
@Entity
@Table(name = "users")
@Data  // Lombok: generates getters, setters, equals, hashCode, toString
@NoArgsConstructor  // Lombok: required by JPA for entity instantiation
@AllArgsConstructor  // Lombok: enables builder pattern
@Builder  // Lombok: enables fluent builder API for object construction
public class User {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    @Column(name = "id")
    private Integer id;

    @Column(name = "firstname")
    private String firstname;

    @Column(name = "lastname")
    private String lastname;

    /**
     * Unique across all users. The column constraint is the authoritative guard
     * against two concurrent registrations with the same address.
     */
    @Column(name = "email", unique = true, nullable = false)
    private String email;

    @ToString.Exclude
    @Column(name = "password", nullable = false)
    private String password;
}
