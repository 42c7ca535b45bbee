package com.pseudoconv.core.generator;

import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * Complete formatting configuration of one pseudocode style.
 *
 * <p>Instances are immutable and shared; use {@link Styles#resolve(StyleId)} to
 * obtain one and {@link #withIndent(int)} to derive a variant.
 *
 * @param id style this configuration belongs to
 * @param keywords keyword spellings
 * @param loopForm loop vocabulary
 * @param trueLiteral spelling of {@code true}
 * @param falseLiteral spelling of {@code false}
 * @param andWord spelling of {@code &&}
 * @param orWord spelling of {@code ||}
 * @param notWord spelling of {@code !}
 * @param notEqual spelling of {@code !=}
 * @param modulo spelling of {@code %}
 * @param indentWidth spaces per nesting level
 * @param wrapRelationalInAssign parenthesize a relational right-hand side of an assignment
 * @param wrapRelationalInLogical parenthesize relational operands of logical chains
 * @param wrapMulInSubtraction parenthesize multiplicative operands of {@code -}
 * @param methodTranslations collection call rewrites, consulted in order
 */
public record StyleConfig(
    StyleId id,
    StyleKeywords keywords,
    LoopForm loopForm,
    String trueLiteral,
    String falseLiteral,
    String andWord,
    String orWord,
    String notWord,
    String notEqual,
    String modulo,
    int indentWidth,
    boolean wrapRelationalInAssign,
    boolean wrapRelationalInLogical,
    boolean wrapMulInSubtraction,
    List<MethodTranslation> methodTranslations
) {

    /**
     * Compact constructor with validation.
     */
    public StyleConfig {
        Objects.requireNonNull(id, "id must not be null");
        Objects.requireNonNull(keywords, "keywords must not be null");
        Objects.requireNonNull(loopForm, "loopForm must not be null");
        if (indentWidth < 0) {
            throw new IllegalArgumentException("indentWidth must not be negative: " + indentWidth);
        }
        methodTranslations = methodTranslations != null ? List.copyOf(methodTranslations) : List.of();
    }

    /**
     * Returns the configuration of the default style.
     *
     * @return sc-02 configuration
     */
    public static StyleConfig defaults() {
        return Styles.resolve(StyleId.DEFAULT);
    }

    /**
     * Returns one indentation unit.
     *
     * @return {@code indentWidth} spaces
     */
    public String indent() {
        return " ".repeat(indentWidth);
    }

    /**
     * Returns a copy with a different indentation width.
     *
     * @param width spaces per nesting level
     * @return adjusted configuration
     */
    public StyleConfig withIndent(int width) {
        return new StyleConfig(id, keywords, loopForm, trueLiteral, falseLiteral, andWord, orWord, notWord,
            notEqual, modulo, width, wrapRelationalInAssign, wrapRelationalInLogical, wrapMulInSubtraction,
            methodTranslations);
    }

    /**
     * Finds the rewrite for a method call: exact arity first, then wildcard entries.
     *
     * @param method called method name
     * @param argumentCount number of arguments
     * @return matching translation, if any
     */
    public Optional<MethodTranslation> translationFor(String method, int argumentCount) {
        Optional<MethodTranslation> exact = methodTranslations.stream()
            .filter(t -> t.arity() != MethodTranslation.ANY_ARITY && t.matches(method, argumentCount))
            .findFirst();
        if (exact.isPresent()) {
            return exact;
        }
        return methodTranslations.stream()
            .filter(t -> t.arity() == MethodTranslation.ANY_ARITY && t.matches(method, argumentCount))
            .findFirst();
    }
}
