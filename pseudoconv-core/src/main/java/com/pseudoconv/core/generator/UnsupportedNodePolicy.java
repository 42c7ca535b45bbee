package com.pseudoconv.core.generator;

import java.util.Locale;

/**
 * What the generator does with a node it cannot render in its position.
 */
public enum UnsupportedNodePolicy {
    /** Emit a placeholder comment line for statements and {@code <?>} for expressions. */
    PLACEHOLDER,

    /** Abort generation with a {@code generation} stage error. */
    FAIL;

    /**
     * Parses a policy name as written in configuration ("placeholder", "fail").
     *
     * @param value policy name, case-insensitive; null selects {@link #PLACEHOLDER}
     * @return the policy
     * @throws IllegalArgumentException if the name is unknown
     */
    public static UnsupportedNodePolicy fromId(String value) {
        if (value == null || value.isBlank()) {
            return PLACEHOLDER;
        }
        return valueOf(value.trim().toUpperCase(Locale.ROOT));
    }
}
