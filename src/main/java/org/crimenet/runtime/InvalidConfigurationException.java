package org.crimenet.runtime;

import java.util.List;

/**
 * Thrown when simulation parameters are rejected before the first tick.
 * <p>
 * All violations found during validation are collected and reported together, so a user
 * fixing a configuration file sees every problem at once. This is a RuntimeException because
 * an invalid configuration cannot be recovered from inside the run: no partial run is started.
 */
public class InvalidConfigurationException extends RuntimeException {

    private final List<String> violations;

    /**
     * Creates an InvalidConfigurationException listing the given violations.
     *
     * @param violations Human-readable descriptions, one per rejected setting. Must not be empty.
     */
    public InvalidConfigurationException(List<String> violations) {
        super("Invalid simulation configuration:\n  - " + String.join("\n  - ", violations));
        this.violations = List.copyOf(violations);
    }

    public List<String> getViolations() {
        return violations;
    }
}
