package de.bsommerfeld.homedash.core.config;

import java.util.Optional;

/**
 * Resolves process configuration values. A JVM system property always wins
 * over the environment variable of the same setting, which lets tests and
 * launch scripts override a container's environment without touching it.
 */
public final class Settings {

    private Settings() {
    }

    /**
     * Returns the first non-blank value of the system property
     * {@code property} or the environment variable {@code envVar}.
     *
     * @param property system property name, e.g. {@code app.mode}
     * @param envVar   environment variable name, e.g. {@code APP_MODE}
     * @return the trimmed value, or empty if neither source is set
     */
    public static Optional<String> lookup(String property, String envVar) {
        String value = System.getProperty(property);
        if (value == null || value.isBlank()) {
            value = System.getenv(envVar);
        }
        if (value == null || value.isBlank()) {
            return Optional.empty();
        }
        return Optional.of(value.trim());
    }
}
