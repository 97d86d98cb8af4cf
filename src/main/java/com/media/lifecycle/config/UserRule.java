package com.media.lifecycle.config;

import com.media.lifecycle.core.model.Requester;

import java.util.Objects;

/**
 * Per-user entry of a {@link RuleType#USER} rule. At least one of the identifiers must be set.
 *
 * @param userId         request-source user id, or null
 * @param username       username, compared ignoring case, or null
 * @param email          email, compared ignoring case, or null
 * @param retention      retention duration string
 * @param requireWatched keep the item until it has been watched at least once
 */
public record UserRule(Integer userId, String username, String email, String retention, boolean requireWatched) {

    public UserRule {
        Objects.requireNonNull(retention, "retention is required");
        if (userId == null && isBlank(username) && isBlank(email)) {
            throw new IllegalArgumentException("user rule needs a userId, username or email");
        }
    }

    public static UserRule forUserId(int userId, String retention, boolean requireWatched) {
        return new UserRule(userId, null, null, retention, requireWatched);
    }

    public static UserRule forUsername(String username, String retention, boolean requireWatched) {
        return new UserRule(null, username, null, retention, requireWatched);
    }

    public static UserRule forEmail(String email, String retention, boolean requireWatched) {
        return new UserRule(null, null, email, retention, requireWatched);
    }

    /**
     * Returns true if this entry identifies the requester, by user id, then username, then email.
     */
    public boolean matches(Requester requester) {
        if (requester == null) {
            return false;
        }
        if (userId != null && userId.equals(requester.userId())) {
            return true;
        }
        if (!isBlank(username) && requester.username() != null
                && username.equalsIgnoreCase(requester.username())) {
            return true;
        }
        return !isBlank(email) && requester.email() != null
                && email.equalsIgnoreCase(requester.email());
    }

    private static boolean isBlank(String s) {
        return s == null || s.isBlank();
    }
}
