package com.pseudoconv.core;

import com.pseudoconv.core.generator.StyleId;
import com.pseudoconv.core.generator.UnsupportedNodePolicy;

import java.util.Objects;

/**
 * Options for a single conversion.
 *
 * @param style output style
 * @param allowMultiDimensionalArrays false selects the minimal scope profile, which rejects {@code a[i][j]}
 * @param unsupportedNodePolicy what the generator does with nodes it cannot render
 * @param indentOverride spaces per nesting level instead of the style's own width, or null
 */
public record ConvertOptions(
    StyleId style,
    boolean allowMultiDimensionalArrays,
    UnsupportedNodePolicy unsupportedNodePolicy,
    Integer indentOverride
) {

    /**
     * Compact constructor with validation.
     */
    public ConvertOptions {
        Objects.requireNonNull(style, "style must not be null");
        Objects.requireNonNull(unsupportedNodePolicy, "unsupportedNodePolicy must not be null");
        if (indentOverride != null && indentOverride < 0) {
            throw new IllegalArgumentException("indentOverride must not be negative: " + indentOverride);
        }
    }

    /**
     * Default options: sc-02, multi-dimensional arrays allowed, placeholders for
     * unsupported nodes, the style's own indentation.
     *
     * @return default options
     */
    public static ConvertOptions defaults() {
        return new ConvertOptions(StyleId.DEFAULT, true, UnsupportedNodePolicy.PLACEHOLDER, null);
    }

    /**
     * Default options with another style.
     *
     * @param style output style
     * @return options for the style
     */
    public static ConvertOptions forStyle(StyleId style) {
        return defaults().withStyle(style);
    }

    public ConvertOptions withStyle(StyleId newStyle) {
        return new ConvertOptions(newStyle, allowMultiDimensionalArrays, unsupportedNodePolicy, indentOverride);
    }

    public ConvertOptions withMultiDimensionalArrays(boolean allowed) {
        return new ConvertOptions(style, allowed, unsupportedNodePolicy, indentOverride);
    }

    public ConvertOptions withUnsupportedNodePolicy(UnsupportedNodePolicy policy) {
        return new ConvertOptions(style, allowMultiDimensionalArrays, policy, indentOverride);
    }

    public ConvertOptions withIndent(Integer indent) {
        return new ConvertOptions(style, allowMultiDimensionalArrays, unsupportedNodePolicy, indent);
    }
}
