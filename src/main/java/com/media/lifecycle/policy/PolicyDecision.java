package com.media.lifecycle.policy;

import java.time.Instant;
import java.util.Objects;

/**
 * Structured result of evaluating one media item against the retention policy.
 * All display text is rendered from these fields.
 *
 * @param shouldDelete true if the item is overdue and should be removed now
 * @param deleteAfter  scheduled deletion time, or null when nothing is scheduled
 * @param code         outcome
 * @param tier         tier that decided
 * @param ruleName     name of the matched advanced rule, or null
 * @param tag          matched tag for tag rules, or null
 * @param retention    retention string that was applied, or null
 */
public record PolicyDecision(
        boolean shouldDelete,
        Instant deleteAfter,
        ReasonCode code,
        RuleTier tier,
        String ruleName,
        String tag,
        String retention
) {

    public PolicyDecision {
        Objects.requireNonNull(code, "code is required");
        Objects.requireNonNull(tier, "tier is required");
        if (shouldDelete && deleteAfter == null) {
            throw new IllegalArgumentException("shouldDelete requires deleteAfter");
        }
    }

    public static PolicyDecision excluded() {
        return new PolicyDecision(false, null, ReasonCode.EXCLUDED, RuleTier.EXCLUSION, null, null, null);
    }

    public static PolicyDecision requested() {
        return new PolicyDecision(false, null, ReasonCode.REQUESTED, RuleTier.STANDARD, null, null, null);
    }

    public static PolicyDecision retentionDisabled(RuleTier tier, String ruleName, String tag, String retention) {
        return new PolicyDecision(false, null, ReasonCode.RETENTION_DISABLED, tier, ruleName, tag, retention);
    }

    public static PolicyDecision invalidRetention(RuleTier tier, String ruleName, String tag, String retention) {
        return new PolicyDecision(false, null, ReasonCode.INVALID_RETENTION, tier, ruleName, tag, retention);
    }

    public static PolicyDecision notWatchedYet(RuleTier tier, String ruleName, String retention) {
        return new PolicyDecision(false, null, ReasonCode.NOT_WATCHED_YET, tier, ruleName, null, retention);
    }

    /**
     * A scheduled deletion; overdue when {@code now} is after {@code deleteAfter}.
     */
    public static PolicyDecision scheduled(Instant deleteAfter, Instant now, RuleTier tier,
                                           String ruleName, String tag, String retention) {
        boolean overdue = now.isAfter(deleteAfter);
        return new PolicyDecision(overdue, deleteAfter,
                overdue ? ReasonCode.RETENTION_EXPIRED : ReasonCode.WITHIN_RETENTION,
                tier, ruleName, tag, retention);
    }

    public boolean hasSchedule() {
        return deleteAfter != null;
    }

    public boolean isOverdue() {
        return code == ReasonCode.RETENTION_EXPIRED;
    }

    /**
     * Short reason, e.g. {@code retention period expired (90d)} or
     * {@code tag rule 'Demo' (tag: demo) within retention (7d)}.
     */
    public String reason() {
        return switch (code) {
            case EXCLUDED -> "excluded";
            case REQUESTED -> "requested";
            case RETENTION_DISABLED -> "retention disabled";
            case NOT_WATCHED_YET -> "not watched yet";
            case INVALID_RETENTION -> tier.isAdvancedRule()
                    ? "invalid " + tier.label() + " retention"
                    : "invalid retention";
            case WITHIN_RETENTION, RETENTION_EXPIRED -> scheduleReason();
        };
    }

    private String scheduleReason() {
        String state = isOverdue() ? "retention expired" : "within retention";
        return switch (tier) {
            case TAG_RULE -> String.format("tag rule '%s' (tag: %s) %s (%s)", ruleName, tag, state, retention);
            case USER_RULE, WATCHED_RULE -> String.format("%s '%s' %s (%s)", tier.label(), ruleName, state, retention);
            default -> isOverdue()
                    ? String.format("retention period expired (%s)", retention)
                    : "within retention";
        };
    }

    @Override
    public String toString() {
        return "PolicyDecision{shouldDelete=" + shouldDelete +
                ", deleteAfter=" + deleteAfter +
                ", reason='" + reason() + '\'' +
                '}';
    }
}
