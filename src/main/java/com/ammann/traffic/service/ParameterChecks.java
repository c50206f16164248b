/* (C)2026 */
package com.ammann.traffic.service;

import com.ammann.traffic.exception.ValidationException;
import java.time.Duration;

/**
 * Parameter guards shared by the analytics components. Every guard throws
 * {@link ValidationException} so a bad request fails before any store read.
 */
public final class ParameterChecks {

    private ParameterChecks() {}

    public static Duration requirePositive(String name, Duration value) {
        if (value == null || value.isZero() || value.isNegative()) {
            throw ValidationException.invalidParameter(name, value, "positive duration");
        }
        return value;
    }

    /**
     * Like {@link #requirePositive(String, Duration)} but {@code null} (meaning "all-time") passes.
     */
    public static Duration requirePositiveOrAbsent(String name, Duration value) {
        return value == null ? null : requirePositive(name, value);
    }

    public static long requirePositive(String name, long value) {
        if (value <= 0) {
            throw ValidationException.invalidParameter(name, value, "positive integer");
        }
        return value;
    }

    public static int requireBetween(String name, int value, int min, int max) {
        if (value < min || value > max) {
            throw ValidationException.invalidParameter(name, value,
                    String.format("integer between %d and %d", min, max));
        }
        return value;
    }

    public static double requirePositiveFinite(String name, double value) {
        if (!Double.isFinite(value) || value <= 0.0) {
            throw ValidationException.invalidParameter(name, value, "positive finite number");
        }
        return value;
    }

    public static String requireNonBlank(String name, String value) {
        if (value == null || value.isBlank()) {
            throw ValidationException.invalidParameter(name, value, "non-blank value");
        }
        return value;
    }
}
