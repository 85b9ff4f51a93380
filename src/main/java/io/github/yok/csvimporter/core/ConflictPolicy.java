package io.github.yok.csvimporter.core;

import java.util.Arrays;
import java.util.Locale;
import java.util.stream.Collectors;

/**
 * Behavior when the destination table already exists.
 *
 * @author Yasuharu.Okawauchi
 */
public enum ConflictPolicy {

    // Abort the run
    FAIL,

    // Drop the table and create it from the inferred schema
    REPLACE,

    // Insert into the existing table after validating column compatibility
    APPEND;

    /**
     * Parses a policy name, ignoring case.
     *
     * @param value {@code fail}, {@code replace} or {@code append}
     * @return policy
     * @throws IllegalArgumentException if the value is not a policy name
     */
    public static ConflictPolicy parse(String value) {
        for (ConflictPolicy policy : values()) {
            if (policy.name().equalsIgnoreCase(value == null ? "" : value.trim())) {
                return policy;
            }
        }
        throw new IllegalArgumentException("Unknown if-exists policy: '" + value + "' (expected "
                + Arrays.stream(values()).map(p -> p.name().toLowerCase(Locale.ROOT))
                        .collect(Collectors.joining(", "))
                + ")");
    }
}
