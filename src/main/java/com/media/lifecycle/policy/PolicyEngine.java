package com.media.lifecycle.policy;

import com.media.lifecycle.config.AdvancedRule;
import com.media.lifecycle.config.ConfigProvider;
import com.media.lifecycle.config.LifecycleConfig;
import com.media.lifecycle.config.RuleType;
import com.media.lifecycle.config.UserRule;
import com.media.lifecycle.core.model.DeletionCandidate;
import com.media.lifecycle.core.model.MediaIds;
import com.media.lifecycle.core.model.MediaItem;
import com.media.lifecycle.core.model.MediaType;
import com.media.lifecycle.exclusion.ExclusionStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.DateTimeException;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * Decides whether and when a media item should be deleted.
 *
 * <p>Tiers are evaluated in order and the first match wins:</p>
 * <ol>
 *   <li>Exclusion: never delete</li>
 *   <li>Tag rules: enabled tag rule whose tag the item carries (case-insensitive)</li>
 *   <li>User rules: requested items, matched by requester id, username, then email</li>
 *   <li>Watched rule: first enabled watched rule</li>
 *   <li>Standard retention for the media type</li>
 * </ol>
 *
 * <p>Retention is measured from the last watch time, or from the time the item was
 * added when it has never been watched. Configuration is read from the
 * {@link ConfigProvider} on every evaluation. The engine never adds or removes items.</p>
 */
public class PolicyEngine {
    private static final Logger log = LoggerFactory.getLogger(PolicyEngine.class);

    private final ConfigProvider configProvider;
    private final ExclusionStore exclusions;
    private final Clock clock;

    public PolicyEngine(ConfigProvider configProvider, ExclusionStore exclusions) {
        this(configProvider, exclusions, Clock.systemUTC());
    }

    public PolicyEngine(ConfigProvider configProvider, ExclusionStore exclusions, Clock clock) {
        this.configProvider = Objects.requireNonNull(configProvider, "configProvider");
        this.exclusions = Objects.requireNonNull(exclusions, "exclusions");
        this.clock = Objects.requireNonNull(clock, "clock");
    }

    /**
     * Evaluates one item against the current configuration.
     */
    public PolicyDecision evaluate(MediaItem item) {
        LifecycleConfig config = configProvider.current();
        Instant now = clock.instant();

        if (item.isExcluded() || exclusions.isExcluded(MediaIds.externalId(item))) {
            return PolicyDecision.excluded();
        }

        if (!item.getTags().isEmpty()) {
            Optional<PolicyDecision> tagDecision = evaluateTagRules(item, config, now);
            if (tagDecision.isPresent()) {
                return tagDecision.get();
            }
        }

        if (item.isRequested() && item.getRequester().hasIdentity()) {
            Optional<PolicyDecision> userDecision = evaluateUserRules(item, config, now);
            if (userDecision.isPresent()) {
                return userDecision.get();
            }
        }

        Optional<PolicyDecision> watchedDecision = evaluateWatchedRules(item, config, now);
        if (watchedDecision.isPresent()) {
            return watchedDecision.get();
        }

        return evaluateStandardRetention(item, config, now);
    }

    private Optional<PolicyDecision> evaluateTagRules(MediaItem item, LifecycleConfig config, Instant now) {
        for (AdvancedRule rule : config.advancedRules()) {
            if (!rule.isActive(RuleType.TAG) || rule.tag() == null || rule.tag().isEmpty()) {
                continue;
            }
            boolean hasTag = item.getTags().stream().anyMatch(tag -> tag.equalsIgnoreCase(rule.tag()));
            if (!hasTag) {
                continue;
            }
            log.debug("policy.tagRuleMatched mediaId={} rule='{}' tag={}", item.getId(), rule.name(), rule.tag());
            return Optional.of(schedule(item, now, RuleTier.TAG_RULE, rule.name(), rule.tag(),
                    rule.retention(), false));
        }
        return Optional.empty();
    }

    private Optional<PolicyDecision> evaluateUserRules(MediaItem item, LifecycleConfig config, Instant now) {
        for (AdvancedRule rule : config.advancedRules()) {
            if (!rule.isActive(RuleType.USER)) {
                continue;
            }
            for (UserRule user : rule.users()) {
                if (user.matches(item.getRequester())) {
                    log.debug("policy.userRuleMatched mediaId={} rule='{}'", item.getId(), rule.name());
                    return Optional.of(schedule(item, now, RuleTier.USER_RULE, rule.name(), null,
                            user.retention(), user.requireWatched()));
                }
            }
        }
        return Optional.empty();
    }

    private Optional<PolicyDecision> evaluateWatchedRules(MediaItem item, LifecycleConfig config, Instant now) {
        for (AdvancedRule rule : config.advancedRules()) {
            if (!rule.isActive(RuleType.WATCHED)) {
                continue;
            }
            log.debug("policy.watchedRuleMatched mediaId={} rule='{}'", item.getId(), rule.name());
            return Optional.of(schedule(item, now, RuleTier.WATCHED_RULE, rule.name(), null,
                    rule.retention(), rule.requireWatched()));
        }
        return Optional.empty();
    }

    private PolicyDecision evaluateStandardRetention(MediaItem item, LifecycleConfig config, Instant now) {
        if (item.isRequested() && config.advancedRules().isEmpty()) {
            return PolicyDecision.requested();
        }

        String retention = config.retention().forType(item.getType());
        Duration duration;
        try {
            duration = RetentionDurations.parse(retention);
        } catch (InvalidDurationException e) {
            log.warn("policy.invalidRetention mediaId={} type={} retention='{}' error={}",
                    item.getId(), item.getType(), retention, e.getMessage());
            return PolicyDecision.invalidRetention(RuleTier.STANDARD, null, null, retention);
        }

        if (duration.isZero()) {
            return PolicyDecision.retentionDisabled(RuleTier.STANDARD, null, null, retention);
        }

        Optional<Instant> deleteAfter = deleteAfter(item, duration);
        if (deleteAfter.isEmpty()) {
            log.warn("policy.retentionOutOfRange mediaId={} type={} retention='{}'",
                    item.getId(), item.getType(), retention);
            return PolicyDecision.invalidRetention(RuleTier.STANDARD, null, null, retention);
        }
        return PolicyDecision.scheduled(deleteAfter.get(), now, RuleTier.STANDARD, null, null, retention);
    }

    /**
     * Shared computation for the advanced rule tiers. An unparsable retention counts as a
     * match that schedules nothing.
     */
    private PolicyDecision schedule(MediaItem item, Instant now, RuleTier tier, String ruleName,
                                    String tag, String retention, boolean requireWatched) {
        Duration duration;
        try {
            duration = RetentionDurations.parse(retention);
        } catch (InvalidDurationException e) {
            log.warn("policy.invalidRuleRetention mediaId={} rule='{}' retention='{}' error={}",
                    item.getId(), ruleName, retention, e.getMessage());
            return PolicyDecision.invalidRetention(tier, ruleName, tag, retention);
        }

        if (duration.isZero()) {
            return PolicyDecision.retentionDisabled(tier, ruleName, tag, retention);
        }

        if (requireWatched && item.getWatchCount() == 0) {
            log.debug("policy.notWatchedYet mediaId={} rule='{}'", item.getId(), ruleName);
            return PolicyDecision.notWatchedYet(tier, ruleName, retention);
        }

        Optional<Instant> deleteAfter = deleteAfter(item, duration);
        if (deleteAfter.isEmpty()) {
            log.warn("policy.ruleRetentionOutOfRange mediaId={} rule='{}' retention='{}'",
                    item.getId(), ruleName, retention);
            return PolicyDecision.invalidRetention(tier, ruleName, tag, retention);
        }
        PolicyDecision decision = PolicyDecision.scheduled(deleteAfter.get(), now, tier, ruleName, tag, retention);
        if (decision.shouldDelete()) {
            log.info("policy.ruleExpired mediaId={} title='{}' tier={} rule='{}' retention={} deleteAfter={}",
                    item.getId(), item.getTitle(), tier, ruleName, retention, deleteAfter.get());
        }
        return decision;
    }

    /**
     * Base time plus retention, or empty when the result is past the supported instant range.
     */
    private static Optional<Instant> deleteAfter(MediaItem item, Duration retention) {
        try {
            return Optional.of(item.retentionBase().plus(retention));
        } catch (DateTimeException | ArithmeticException e) {
            return Optional.empty();
        }
    }

    /**
     * Renders a decision as a sentence for display, e.g.
     * "This movie was added 120 days ago. The retention policy for movies is 90d and it is now
     * scheduled for deletion."
     */
    public String generateDeletionReason(MediaItem item, PolicyDecision decision) {
        String kind = item.getType().displayName();
        String baseEvent = item.getLastWatched() != null ? "last watched" : "added";
        long days = Duration.between(item.retentionBase(), clock.instant()).toDays();
        String opening = String.format("This %s was %s %d days ago.", kind, baseEvent, days);

        switch (decision.code()) {
            case EXCLUDED:
                return String.format("This %s is excluded from deletion.", kind);
            case REQUESTED:
                return String.format("This %s was requested and is kept while no advanced rules are configured.", kind);
            case RETENTION_DISABLED:
                if (decision.tier().isAdvancedRule()) {
                    return String.format("This %s matches the '%s' %s, which never deletes.",
                            kind, decision.ruleName(), decision.tier().label());
                }
                return String.format("Retention is disabled for %s, so this %s will not be deleted.",
                        plural(item.getType()), kind);
            case INVALID_RETENTION:
                return String.format("The retention '%s' for this %s is not valid, so no deletion is scheduled.",
                        decision.retention(), kind);
            case NOT_WATCHED_YET:
                return String.format("%s It matches the '%s' %s, which keeps it until it has been watched.",
                        opening, decision.ruleName(), decision.tier().label());
            default:
                break;
        }

        boolean overdue = decision.isOverdue();
        switch (decision.tier()) {
            case TAG_RULE:
                return overdue
                        ? String.format("%s It matched the '%s' tag rule (tag: %s) with %s retention and is now scheduled for deletion.",
                        opening, decision.ruleName(), decision.tag(), decision.retention())
                        : String.format("%s It matches the '%s' tag rule (tag: %s) with %s retention, meaning it will be deleted after that period of inactivity.",
                        opening, decision.ruleName(), decision.tag(), decision.retention());
            case USER_RULE:
            case WATCHED_RULE:
                return overdue
                        ? String.format("%s It matched the '%s' %s with %s retention and is now scheduled for deletion.",
                        opening, decision.ruleName(), decision.tier().label(), decision.retention())
                        : String.format("%s It matches the '%s' %s with %s retention, meaning it will be deleted after that period of inactivity.",
                        opening, decision.ruleName(), decision.tier().label(), decision.retention());
            default:
                return overdue
                        ? String.format("%s The retention policy for %s is %s and it is now scheduled for deletion.",
                        opening, plural(item.getType()), decision.retention())
                        : String.format("%s The retention policy for %s is %s, meaning it will be deleted after that period of inactivity.",
                        opening, plural(item.getType()), decision.retention());
        }
    }

    /**
     * Evaluates every item and returns those that are overdue.
     */
    public List<DeletionCandidate> getDeletionCandidates(Collection<MediaItem> items) {
        Instant now = clock.instant();
        List<DeletionCandidate> candidates = new ArrayList<>();
        for (MediaItem item : items) {
            PolicyDecision decision = evaluate(item);
            if (decision.shouldDelete()) {
                long daysOverdue = Duration.between(decision.deleteAfter(), now).toDays();
                candidates.add(DeletionCandidate.of(item, decision.deleteAfter(), daysOverdue,
                        generateDeletionReason(item, decision)));
            }
        }
        log.info("policy.candidatesEvaluated total={} candidates={}", items.size(), candidates.size());
        return candidates;
    }

    /**
     * Returns copies of the items scheduled for deletion within the next {@code windowDays}
     * days, annotated with their schedule and reason.
     */
    public List<MediaItem> getLeavingSoon(Collection<MediaItem> items, int windowDays) {
        Instant now = clock.instant();
        List<MediaItem> leavingSoon = new ArrayList<>();
        for (MediaItem item : items) {
            PolicyDecision decision = evaluate(item);
            if (decision.shouldDelete() || !decision.hasSchedule()) {
                continue;
            }
            int daysUntilDue = (int) Duration.between(now, decision.deleteAfter()).toDays();
            if (daysUntilDue > 0 && daysUntilDue <= windowDays) {
                MediaItem copy = item.copy();
                copy.applySchedule(decision.deleteAfter(), daysUntilDue, generateDeletionReason(item, decision));
                leavingSoon.add(copy);
            }
        }
        log.debug("policy.leavingSoon count={} windowDays={}", leavingSoon.size(), windowDays);
        return leavingSoon;
    }

    private static String plural(MediaType type) {
        return type.displayName() + "s";
    }
}
