package com.appraisalplatform.orchestrator.manager;

import java.time.Duration;
import java.util.Objects;

/**
 * Timing of the manager's health and performance loops.
 * With {@code loopsEnabled} false, passes only run when triggered explicitly.
 *
 * <p>An unhealthy agent is re-initialized at most {@code maxRecoveryAttempts} times, no more
 * often than once per {@code recoveryCooldown}. Zero attempts disables recovery.
 */
public record SupervisionSettings(
    Duration healthCheckInterval,
    Duration performanceCheckInterval,
    Duration healthCheckTimeout,
    boolean loopsEnabled,
    int maxRecoveryAttempts,
    Duration recoveryCooldown,
    boolean broadcastHealthStatus
) {
    public static final int DEFAULT_MAX_RECOVERY_ATTEMPTS = 3;
    public static final Duration DEFAULT_RECOVERY_COOLDOWN = Duration.ofSeconds(60);

    public SupervisionSettings {
        Objects.requireNonNull(healthCheckInterval, "healthCheckInterval");
        Objects.requireNonNull(performanceCheckInterval, "performanceCheckInterval");
        Objects.requireNonNull(healthCheckTimeout, "healthCheckTimeout");
        Objects.requireNonNull(recoveryCooldown, "recoveryCooldown");
        if (maxRecoveryAttempts < 0) {
            throw new IllegalArgumentException("maxRecoveryAttempts must not be negative but was " + maxRecoveryAttempts);
        }
    }

    public SupervisionSettings(Duration healthCheckInterval, Duration performanceCheckInterval,
                               Duration healthCheckTimeout, boolean loopsEnabled) {
        this(healthCheckInterval, performanceCheckInterval, healthCheckTimeout, loopsEnabled,
             DEFAULT_MAX_RECOVERY_ATTEMPTS, DEFAULT_RECOVERY_COOLDOWN, true);
    }

    public static SupervisionSettings defaults() {
        return new SupervisionSettings(Duration.ofSeconds(60), Duration.ofSeconds(300), Duration.ofSeconds(5), true);
    }

    public SupervisionSettings withoutLoops() {
        return new SupervisionSettings(healthCheckInterval, performanceCheckInterval, healthCheckTimeout, false,
                                       maxRecoveryAttempts, recoveryCooldown, broadcastHealthStatus);
    }

    public SupervisionSettings withRecovery(int maxAttempts, Duration cooldown) {
        return new SupervisionSettings(healthCheckInterval, performanceCheckInterval, healthCheckTimeout, loopsEnabled,
                                       maxAttempts, cooldown, broadcastHealthStatus);
    }

    public boolean recoveryEnabled() {
        return maxRecoveryAttempts > 0;
    }
}
