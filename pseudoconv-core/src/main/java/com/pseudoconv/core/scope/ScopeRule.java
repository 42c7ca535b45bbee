package com.pseudoconv.core.scope;

import java.util.Objects;
import java.util.regex.Pattern;

/**
 * A single denylist check applied by the {@link ScopeGuard}.
 *
 * @param id stable rule identifier (e.g., "switch")
 * @param pattern boundary-anchored pattern that detects the construct
 * @param reason fixed message reported when the rule matches
 */
public record ScopeRule(String id, Pattern pattern, String reason) {

    /**
     * Compact constructor with validation.
     */
    public ScopeRule {
        Objects.requireNonNull(id, "id must not be null");
        Objects.requireNonNull(pattern, "pattern must not be null");
        Objects.requireNonNull(reason, "reason must not be null");
    }

    /**
     * Creates a rule from a regex string.
     *
     * @param id rule identifier
     * @param regex pattern source
     * @param reason reported message
     * @return the rule
     */
    public static ScopeRule of(String id, String regex, String reason) {
        return new ScopeRule(id, Pattern.compile(regex), reason);
    }

    /**
     * Returns true if the construct occurs anywhere in the text.
     *
     * @param text string-masked normalized source
     * @return true on match
     */
    public boolean matches(String text) {
        return pattern.matcher(text).find();
    }
}
