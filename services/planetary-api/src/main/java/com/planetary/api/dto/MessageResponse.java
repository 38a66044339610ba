package com.planetary.api.dto;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * MessageResponse - the {@code {"message": "..."}} body returned by every
 * endpoint that does not return a planet or a planet list, including errors.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
public class MessageResponse {

    private String message;
}
