package com.media.lifecycle.health;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Runs the registered checks and combines them. The worst status wins, and the
 * aggregate message names the first check that reported it.
 */
public class HealthCheckRegistry {
    private static final Logger log = LoggerFactory.getLogger(HealthCheckRegistry.class);

    private final List<HealthCheck> checks = new ArrayList<>();

    public synchronized void register(HealthCheck check) {
        if (check != null) {
            checks.add(check);
        }
    }

    public synchronized HealthStatus checkAll() {
        if (checks.isEmpty()) {
            return HealthStatus.up("No health checks registered");
        }

        Map<String, Object> results = new LinkedHashMap<>();
        HealthStatus.Status worst = HealthStatus.Status.UP;
        String message = "OK";
        for (HealthCheck check : checks) {
            HealthStatus result = run(check);
            results.put(check.name(), Map.of(
                    "status", result.status().name(),
                    "message", result.message(),
                    "details", result.details()));
            if (worst.worse(result.status()) != worst) {
                worst = result.status();
                message = check.name() + ": " + result.message();
            }
        }
        return new HealthStatus(worst, message, results);
    }

    public synchronized int size() {
        return checks.size();
    }

    private static HealthStatus run(HealthCheck check) {
        try {
            return check.check();
        } catch (RuntimeException e) {
            log.warn("health.checkFailed check={} error={}", check.name(), e.getMessage());
            return HealthStatus.failed("check failed", e);
        }
    }
}
