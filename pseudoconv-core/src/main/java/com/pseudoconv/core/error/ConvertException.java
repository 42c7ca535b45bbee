package com.pseudoconv.core.error;

import java.util.Objects;

/**
 * Unchecked carrier for a {@link ConvertError} raised deep inside a stage.
 *
 * <p>The parser throws it from wherever a mismatch is detected; stage entry
 * points catch it and turn it back into a failed {@link StageResult}, so it
 * never escapes {@code PseudocodeConverter#convert}.
 */
public class ConvertException extends RuntimeException {

    private final ConvertError error;

    public ConvertException(ConvertError error) {
        super(Objects.requireNonNull(error, "error must not be null").message());
        this.error = error;
    }

    public ConvertException(Stage stage, String message, int line, int column) {
        this(new ConvertError(stage, message, line, column));
    }

    /**
     * Returns the structured error carried by this exception.
     *
     * @return the error
     */
    public ConvertError getError() {
        return error;
    }
}
