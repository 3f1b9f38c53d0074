package com.pandemies.backend.modules.admin.application.dto;

import jakarta.validation.constraints.Email;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Size;

public record CreateUserCommand(
        @NotBlank @Size(max = 50) String username,
        @NotBlank @Size(min = 8, max = 72) String password,
        @NotBlank String role,
        @Email @Size(max = 100) String email,
        @Size(max = 100) String fullName
) {

    @Override
    public String toString() {
        return "CreateUserCommand[username=" + username + ", role=" + role + "]";
    }
}
