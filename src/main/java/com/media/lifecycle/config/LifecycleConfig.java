package com.media.lifecycle.config;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Immutable snapshot of the engine configuration.
 * Obtain the live snapshot through a {@link ConfigProvider}; never cache it across evaluations.
 *
 * @param app           deletion switches
 * @param sync          scheduling
 * @param retention     standard retention per media type
 * @param advancedRules advanced rules, in evaluation order
 */
public record LifecycleConfig(
        AppSettings app,
        SyncSettings sync,
        StandardRetention retention,
        List<AdvancedRule> advancedRules
) {

    public LifecycleConfig {
        Objects.requireNonNull(app, "app is required");
        Objects.requireNonNull(sync, "sync is required");
        Objects.requireNonNull(retention, "retention is required");
        advancedRules = advancedRules != null ? List.copyOf(advancedRules) : List.of();
    }

    public static LifecycleConfig defaults() {
        return builder().build();
    }

    /**
     * Returns true if any enabled rule of the given type exists.
     */
    public boolean hasActiveRule(RuleType type) {
        return advancedRules.stream().anyMatch(rule -> rule.isActive(type));
    }

    public static Builder builder() {
        return new Builder();
    }

    public static Builder builder(LifecycleConfig config) {
        return new Builder()
                .app(config.app)
                .sync(config.sync)
                .retention(config.retention)
                .advancedRules(config.advancedRules);
    }

    public static class Builder {
        private AppSettings app = AppSettings.defaults();
        private SyncSettings sync = SyncSettings.defaults();
        private StandardRetention retention = StandardRetention.defaults();
        private List<AdvancedRule> advancedRules = List.of();

        public Builder app(AppSettings app) {
            this.app = app;
            return this;
        }

        public Builder sync(SyncSettings sync) {
            this.sync = sync;
            return this;
        }

        public Builder retention(StandardRetention retention) {
            this.retention = retention;
            return this;
        }

        public Builder retention(String movieRetention, String tvRetention) {
            this.retention = new StandardRetention(movieRetention, tvRetention);
            return this;
        }

        public Builder advancedRules(List<AdvancedRule> advancedRules) {
            this.advancedRules = advancedRules;
            return this;
        }

        public Builder advancedRule(AdvancedRule rule) {
            List<AdvancedRule> rules = new ArrayList<>(advancedRules);
            rules.add(rule);
            this.advancedRules = rules;
            return this;
        }

        public LifecycleConfig build() {
            return new LifecycleConfig(app, sync, retention, advancedRules);
        }
    }
}
