package com.openforge.writecrew.auth;

/**
 * Principal placed in the SecurityContext by {@link JwtAuthFilter}.
 *
 * @param userId   users.id
 * @param username login name
 * @param tier     subscription tier, copied into every ActionContext
 */
public record AuthenticatedUser(Long userId, String username, String tier) {

    /** Actor id used on document changes and permission audit rows. */
    public String actorId() {
        return "user:" + userId;
    }
}
