package com.openforge.writecrew.auth.dto;

import jakarta.validation.constraints.Email;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Pattern;
import jakarta.validation.constraints.Size;

/**
 * Self-service signup. Tier defaults to "free" when omitted; paid tiers are
 * assigned by billing, which lives outside this service.
 */
public record RegisterRequest(
        @NotBlank
        @Size(min = 3, max = 64)
        String username,

        @Email
        String email,

        @NotBlank
        @Size(min = 6, max = 72)
        String password,

        @Size(max = 128)
        String displayName,

        @Pattern(regexp = "free|pro|team", message = "tier must be one of free, pro, team")
        String tier
) {
}
