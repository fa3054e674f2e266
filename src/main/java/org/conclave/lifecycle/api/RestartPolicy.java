package org.conclave.lifecycle.api;

import com.typesafe.config.Config;
import com.typesafe.config.ConfigFactory;

import java.time.Duration;
import java.util.Map;

/**
 * Decides when the health loop restarts a failing service.
 *
 * @param failureThreshold Consecutive health check failures that trigger a restart cycle.
 * @param backoff          Delay between stopping and starting again.
 * @param maxRestarts      Restarts allowed per service; negative means unlimited.
 */
public record RestartPolicy(int failureThreshold, Duration backoff, int maxRestarts) {

    public RestartPolicy {
        if (failureThreshold <= 0) {
            throw new IllegalArgumentException("failure-threshold must be positive");
        }
        if (backoff == null || backoff.isNegative()) {
            throw new IllegalArgumentException("backoff must not be negative");
        }
    }

    /**
     * Three failures, immediate restart, no limit.
     *
     * @return The default policy.
     */
    public static RestartPolicy defaults() {
        return new RestartPolicy(3, Duration.ZERO, -1);
    }

    /**
     * Reads a policy from a {@code restart} configuration block.
     *
     * @param options The block; missing keys fall back to {@link #defaults()}.
     * @return The configured policy.
     */
    public static RestartPolicy fromConfig(Config options) {
        Config finalConfig = options.withFallback(ConfigFactory.parseMap(Map.of(
                "failure-threshold", 3,
                "backoff", "0s",
                "max-restarts", -1
        )));
        return new RestartPolicy(
                finalConfig.getInt("failure-threshold"),
                finalConfig.getDuration("backoff"),
                finalConfig.getInt("max-restarts"));
    }

    /**
     * @param restartsSoFar Restarts already performed for the service.
     * @return Whether another restart is allowed.
     */
    public boolean allowsRestart(int restartsSoFar) {
        return maxRestarts < 0 || restartsSoFar < maxRestarts;
    }
}
