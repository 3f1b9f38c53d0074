package com.pandemies.backend.modules.auth.application.dto;

import jakarta.validation.constraints.NotBlank;

public record LoginCommand(
        @NotBlank(message = "username is required") String username,
        @NotBlank(message = "password is required") String password,
        String sourceAddress,
        String clientDescriptor
) {

    @Override
    public String toString() {
        return "LoginCommand[username=" + username + ", sourceAddress=" + sourceAddress + "]";
    }
}
