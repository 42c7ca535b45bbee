package com.pseudoconv.core;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.pseudoconv.core.error.ConvertError;

import java.util.List;
import java.util.Objects;

/**
 * Outcome of a conversion: pseudocode or errors, never both.
 *
 * <p>Serializes to {@code {"pseudocode": "..."}} or
 * {@code {"errors": [{"stage": ..., "message": ..., "line": ..., "column": ...}]}}.
 *
 * @param pseudocode generated text (null on failure)
 * @param errors errors in the order found (null on success)
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record ConvertResult(
    @JsonProperty("pseudocode") String pseudocode,
    @JsonProperty("errors") List<ConvertError> errors
) {

    /**
     * Compact constructor with validation.
     */
    public ConvertResult {
        if ((pseudocode == null) == (errors == null)) {
            throw new IllegalArgumentException("Exactly one of pseudocode or errors must be present");
        }
        if (errors != null) {
            if (errors.isEmpty()) {
                throw new IllegalArgumentException("errors must not be empty");
            }
            errors = List.copyOf(errors);
        }
    }

    public static ConvertResult success(String pseudocode) {
        return new ConvertResult(Objects.requireNonNull(pseudocode, "pseudocode must not be null"), null);
    }

    public static ConvertResult failure(ConvertError error) {
        return new ConvertResult(null, List.of(Objects.requireNonNull(error, "error must not be null")));
    }

    /**
     * Returns true if pseudocode was produced.
     *
     * @return true on success
     */
    @JsonIgnore
    public boolean isSuccess() {
        return pseudocode != null;
    }
}
