package com.media.lifecycle.core.model;

/**
 * Identity of the user who requested a media item. Any field may be absent.
 *
 * @param userId   numeric user id in the request source, or null
 * @param username display or login name, or null
 * @param email    email address, or null
 */
public record Requester(Integer userId, String username, String email) {

    public static Requester none() {
        return new Requester(null, null, null);
    }

    /**
     * Returns true if at least one identifier is known.
     */
    public boolean hasIdentity() {
        return userId != null
                || (username != null && !username.isBlank())
                || (email != null && !email.isBlank());
    }
}
