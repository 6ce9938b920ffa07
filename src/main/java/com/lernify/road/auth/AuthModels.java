package com.lernify.road.auth;

import jakarta.validation.constraints.Email;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Size;

public class AuthModels {
    public record RegisterRequest(@NotNull @Size(min = 2, max = 50) String firstName,
                                  @NotNull @Size(min = 2, max = 50) String lastName,
                                  @NotBlank @Email String email,
                                  @NotNull @Size(min = 10, max = 15) String phone,
                                  @NotBlank String qualification,
                                  @NotNull @Size(min = 6, max = 128) String password) {}

    public record RegisterResponse(boolean ok, String userId) {}

    public record LoginRequest(@NotBlank @Email String email, @NotNull String password) {}

    public record LoginResponse(String token, String firstName, String lastName) {}

    public record ChangePasswordRequest(@NotNull String oldPassword,
                                        @NotNull @Size(min = 6, max = 128) String newPassword) {}

    /** The caller resolved from a bearer token. */
    public record AuthenticatedUser(String userId, String email) {}
}
