package com.media.lifecycle.source;

import com.media.lifecycle.core.model.Requester;

/**
 * User who made a request.
 *
 * @param id                  request-source user id, 0 when unknown
 * @param displayName         display name, may be empty
 * @param mediaServerUsername username on the media server, may be empty
 * @param username            local username, may be empty
 * @param email               email, may be empty
 */
public record RequestUser(int id, String displayName, String mediaServerUsername, String username, String email) {

    /**
     * Converts to a requester, preferring display name, then media-server username,
     * then local username.
     */
    public Requester toRequester() {
        String resolved = firstNonBlank(displayName, mediaServerUsername, username);
        return new Requester(
                id > 0 ? id : null,
                resolved,
                email != null && !email.isBlank() ? email : null);
    }

    private static String firstNonBlank(String... values) {
        for (String value : values) {
            if (value != null && !value.isBlank()) {
                return value;
            }
        }
        return null;
    }
}
