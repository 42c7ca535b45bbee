package com.pseudoconv.core.error;

import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Pipeline stage that produced a {@link ConvertError}.
 */
public enum Stage {
    /** Blank or missing source text */
    INPUT("input"),

    /** Out-of-scope construct rejected before tokenizing */
    SCOPE("scope"),

    /** Unterminated literal or unsupported character */
    TOKENIZATION("tokenization"),

    /** Unexpected or missing token, invalid assignment target */
    PARSE("parse"),

    /** Node kind the generator cannot render (fail-closed policy only) */
    GENERATION("generation");

    private final String id;

    Stage(String id) {
        this.id = id;
    }

    /**
     * Returns the stable, machine-checkable stage identifier.
     *
     * @return lowercase stage id (e.g., "parse")
     */
    @JsonValue
    public String id() {
        return id;
    }

    @Override
    public String toString() {
        return id;
    }
}
