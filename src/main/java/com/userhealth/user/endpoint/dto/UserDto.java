package com.userhealth.user.endpoint.dto;

import com.userhealth.user.domain.User;

/**
 * Response DTO for user records.
 */
public record UserDto(
        long id,
        String name,
        String email
) {

    public static UserDto from(User user) {
        return new UserDto(user.getId(), user.getName(), user.getEmail());
    }
}
