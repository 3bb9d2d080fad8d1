package com.tasktrack.api.auth;

import com.tasktrack.api.users.Identity;
import jakarta.validation.constraints.Email;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotEmpty;
import jakarta.validation.constraints.Pattern;
import jakarta.validation.constraints.Size;

import java.time.Instant;
import java.util.UUID;

record RegisterRequest(
        @NotBlank @Email @Size(max = 255) String email,
        @NotBlank @Size(min = 3, max = 50) @Pattern(regexp = "[^@]*", message = "must not contain '@'") String username,
        // byte limit is checked by AuthService, multi-byte characters can pass this
        @NotEmpty @Size(max = 72) String password) {}

record LoginRequest(@NotBlank String username, @NotBlank String password) {}

record TokenResponse(String accessToken, String tokenType, long expiresIn) {}

record UserResponse(UUID id, String email, String username, Instant createdAt) {
    static UserResponse of(Identity identity) {
        return new UserResponse(identity.id(), identity.email(), identity.username(), identity.createdAt());
    }
}
