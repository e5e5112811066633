package org.javai.policy;

import java.time.Duration;
import java.util.Objects;

/**
 * Build-time argument checks shared by the policy builders.
 */
final class PolicyArguments {

    private PolicyArguments() {
    }

    static void requirePositive(int value, String name) {
        if (value <= 0) {
            throw new IllegalArgumentException(name + " must be > 0, was: " + value);
        }
    }

    static void requirePositive(Duration value, String name) {
        Objects.requireNonNull(value, name + " must not be null");
        if (value.isZero() || value.isNegative()) {
            throw new IllegalArgumentException(name + " must be positive, was: " + value);
        }
    }
}
