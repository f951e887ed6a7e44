package com.launchpad.bootstrap;

import java.util.Arrays;
import java.util.Locale;

/**
 * Deployment environment the process runs in, read from {@code app.node-env}.
 *
 * The environment decides the logging profile and whether the web server
 * shuts down gracefully.
 */
public enum RuntimeEnvironment {

    LOCAL("local"),
    DEVELOPMENT("development"),
    STAGING("staging"),
    PRODUCTION("production"),
    TEST("test");

    private final String value;

    RuntimeEnvironment(String value) {
        this.value = value;
    }

    public String getValue() {
        return value;
    }

    public boolean isLocal() {
        return this == LOCAL;
    }

    public boolean isTest() {
        return this == TEST;
    }

    /**
     * Graceful shutdown is skipped for local runs and test contexts.
     *
     * @return true when in-flight requests should be drained on shutdown
     */
    public boolean shutsDownGracefully() {
        return this != LOCAL && this != TEST;
    }

    /**
     * Parse an environment name, ignoring case and surrounding whitespace.
     *
     * @param value the configured environment name
     * @return the matching environment
     * @throws IllegalArgumentException if the name is blank or unknown
     */
    public static RuntimeEnvironment from(String value) {
        if (value == null || value.isBlank()) {
            throw new IllegalArgumentException("app.node-env must be set");
        }
        String normalized = value.trim().toLowerCase(Locale.ROOT);
        return Arrays.stream(values())
                .filter(environment -> environment.value.equals(normalized))
                .findFirst()
                .orElseThrow(() -> new IllegalArgumentException(
                        String.format("Unknown environment '%s'. Expected one of: local, development, staging, production, test", value)
                ));
    }

    @Override
    public String toString() {
        return value;
    }
}
