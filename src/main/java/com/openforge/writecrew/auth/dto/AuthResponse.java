package com.openforge.writecrew.auth.dto;

/**
 * Returned by register and login. The token goes into the Authorization
 * header of every permission, approval and document call.
 */
public record AuthResponse(
        Long userId,
        String username,
        String displayName,
        String tier,
        String token
) {
}
