package com.pseudoconv.core.error;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;

import java.util.Objects;

/**
 * Structured error reported by any stage of the conversion pipeline.
 *
 * <p>Fields are stable so that hosts (CLI, API wrappers) can forward the error
 * without further transformation. Positions are 1-based.
 *
 * @param stage stage that detected the fault
 * @param message human-readable description
 * @param line 1-based line of the offending character or token
 * @param column 1-based column of the offending character or token
 */
@JsonPropertyOrder({"stage", "message", "line", "column"})
public record ConvertError(
    @JsonProperty("stage") Stage stage,
    @JsonProperty("message") String message,
    @JsonProperty("line") int line,
    @JsonProperty("column") int column
) {
    /**
     * Compact constructor with validation.
     */
    public ConvertError {
        Objects.requireNonNull(stage, "stage must not be null");
        Objects.requireNonNull(message, "message must not be null");
        if (line < 1) {
            line = 1;
        }
        if (column < 1) {
            column = 1;
        }
    }

    /**
     * Creates an error without a meaningful position (reported at 1:1).
     *
     * @param stage stage that detected the fault
     * @param message human-readable description
     * @return error positioned at line 1, column 1
     */
    public static ConvertError at(Stage stage, String message) {
        return new ConvertError(stage, message, 1, 1);
    }

    /**
     * Formats the error as a single line, e.g. {@code parse 3:14 Expected ';' after assignment}.
     *
     * @return one-line representation
     */
    public String toLine() {
        return stage.id() + " " + line + ":" + column + " " + message;
    }
}
