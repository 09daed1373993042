package com.arkhamsim.common;

import java.util.Optional;

/**
 * Abstraction for reading environment variables or configuration values.
 * <p>
 * Used to avoid direct calls to {@link System#getenv(String)} in code,
 * so that unit tests can provide their own environment source.
 */
@FunctionalInterface
public interface IEnvGetter {
    /**
     * Default implementation backed by {@link System#getenv(String)}.
     */
    IEnvGetter env = System::getenv;

    /**
     * Returns the value of the given environment variable, or {@code null} if unset.
     */
    String get(String name);

    /**
     * Returns the value of the environment variable, throwing if missing or blank.
     */
    static String getString(IEnvGetter env, String name) {
        String value = env.get(name);
        if (value == null || value.isBlank()) {
            throw new IllegalStateException("Missing required environment variable: " + name);
        }
        return value;
    }

    /**
     * Returns the long value of the environment variable, throwing if missing, blank, or invalid.
     */
    static long getLong(IEnvGetter env, String name) {
        return parseLong(name, getString(env, name));
    }

    static long getLongOr(IEnvGetter env, String name, long defaultValue) {
        return getOptionalLong(env, name).orElse(defaultValue);
    }

    /**
     * Empty when unset or blank; throws if set to something that is not a long.
     */
    static Optional<Long> getOptionalLong(IEnvGetter env, String name) {
        String value = env.get(name);
        if (value == null || value.isBlank()) return Optional.empty();
        return Optional.of(parseLong(name, value));
    }

    private static long parseLong(String name, String value) {
        try {
            return Long.parseLong(value.trim());
        } catch (NumberFormatException e) {
            throw new IllegalStateException("Invalid long for environment variable: " + name + " = '" + value + "'", e);
        }
    }
}
