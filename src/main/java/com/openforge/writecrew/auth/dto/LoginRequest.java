package com.openforge.writecrew.auth.dto;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Size;

/**
 * Login with username or email as the identifier.
 */
public record LoginRequest(
        @NotBlank @Size(max = 128) String identifier,
        @NotBlank @Size(min = 6, max = 72) String password
) {
}
