package com.planetary.api.dto;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Body of a successful registration: the confirmation message and the new user.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
public class RegistrationResponse {

    private String message;

    private UserResponse user;
}
