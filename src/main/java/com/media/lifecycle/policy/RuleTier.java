package com.media.lifecycle.policy;

/**
 * Rule categories in evaluation order. The first tier that matches decides.
 */
public enum RuleTier {
    EXCLUSION("exclusion"),
    TAG_RULE("tag rule"),
    USER_RULE("user rule"),
    WATCHED_RULE("watched rule"),
    STANDARD("standard retention");

    private final String label;

    RuleTier(String label) {
        this.label = label;
    }

    public String label() {
        return label;
    }

    public boolean isAdvancedRule() {
        return this == TAG_RULE || this == USER_RULE || this == WATCHED_RULE;
    }
}
