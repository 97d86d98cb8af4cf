package com.media.lifecycle.config;

import java.util.List;
import java.util.Objects;

/**
 * A named retention rule that takes precedence over standard retention.
 *
 * @param name           display name, used in deletion reasons
 * @param type           rule kind
 * @param enabled        disabled rules are ignored
 * @param tag            tag to match, for {@link RuleType#TAG}
 * @param retention      retention duration string, for {@link RuleType#TAG} and {@link RuleType#WATCHED}
 * @param requireWatched for {@link RuleType#WATCHED}, keep items that were never watched
 * @param users          per-user entries, for {@link RuleType#USER}
 */
public record AdvancedRule(
        String name,
        RuleType type,
        boolean enabled,
        String tag,
        String retention,
        boolean requireWatched,
        List<UserRule> users
) {

    public AdvancedRule {
        Objects.requireNonNull(name, "name is required");
        Objects.requireNonNull(type, "type is required");
        users = users != null ? List.copyOf(users) : List.of();
    }

    public static AdvancedRule tagRule(String name, String tag, String retention) {
        return new AdvancedRule(name, RuleType.TAG, true, tag, retention, false, List.of());
    }

    public static AdvancedRule userRule(String name, List<UserRule> users) {
        return new AdvancedRule(name, RuleType.USER, true, null, null, false, users);
    }

    public static AdvancedRule watchedRule(String name, String retention, boolean requireWatched) {
        return new AdvancedRule(name, RuleType.WATCHED, true, null, retention, requireWatched, List.of());
    }

    public AdvancedRule withEnabled(boolean enabled) {
        return new AdvancedRule(name, type, enabled, tag, retention, requireWatched, users);
    }

    public boolean isActive(RuleType ruleType) {
        return enabled && type == ruleType;
    }
}
