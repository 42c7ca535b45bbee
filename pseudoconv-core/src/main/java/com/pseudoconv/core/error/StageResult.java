package com.pseudoconv.core.error;

import java.util.Objects;

/**
 * Outcome of a single pipeline stage: either a value or an error, never both.
 *
 * @param value stage output (null when failed)
 * @param error stage error (null when successful)
 * @param <T> type of the stage output
 */
public record StageResult<T>(T value, ConvertError error) {

    /**
     * Compact constructor with validation.
     */
    public StageResult {
        if ((value == null) == (error == null)) {
            throw new IllegalArgumentException("Exactly one of value or error must be present");
        }
    }

    /**
     * Creates a successful result.
     *
     * @param value stage output
     * @param <T> type of the stage output
     * @return successful result
     */
    public static <T> StageResult<T> ok(T value) {
        return new StageResult<>(Objects.requireNonNull(value, "value must not be null"), null);
    }

    /**
     * Creates a failed result.
     *
     * @param error the stage error
     * @param <T> type of the stage output
     * @return failed result
     */
    public static <T> StageResult<T> failed(ConvertError error) {
        return new StageResult<>(null, Objects.requireNonNull(error, "error must not be null"));
    }

    /**
     * Returns true if the stage produced a value.
     *
     * @return true on success
     */
    public boolean isSuccess() {
        return error == null;
    }
}
