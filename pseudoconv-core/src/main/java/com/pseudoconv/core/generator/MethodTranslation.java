package com.pseudoconv.core.generator;

import java.util.Objects;

/**
 * One entry of a style's method-translation table.
 *
 * <p>Entries are matched by method name and argument count; an entry with
 * {@link #ANY_ARITY} matches any count and is consulted only after exact-arity
 * entries.
 *
 * @param method Java method name
 * @param arity argument count, or {@link #ANY_ARITY}
 * @param kind rewrite applied to matching calls
 * @param alias replacement name for RENAME and FUNCTION_FORM, otherwise null
 */
public record MethodTranslation(String method, int arity, TranslationKind kind, String alias) {

    /** Arity wildcard. */
    public static final int ANY_ARITY = -1;

    /**
     * Compact constructor with validation.
     */
    public MethodTranslation {
        Objects.requireNonNull(method, "method must not be null");
        Objects.requireNonNull(kind, "kind must not be null");
        if ((kind == TranslationKind.RENAME || kind == TranslationKind.FUNCTION_FORM) && alias == null) {
            throw new IllegalArgumentException(kind + " translation of '" + method + "' needs an alias");
        }
    }

    public static MethodTranslation rename(String method, int arity, String alias) {
        return new MethodTranslation(method, arity, TranslationKind.RENAME, alias);
    }

    public static MethodTranslation functionForm(String method, int arity, String function) {
        return new MethodTranslation(method, arity, TranslationKind.FUNCTION_FORM, function);
    }

    public static MethodTranslation subscriptRead(String method) {
        return new MethodTranslation(method, 1, TranslationKind.SUBSCRIPT_READ, null);
    }

    public static MethodTranslation subscriptWrite(String method) {
        return new MethodTranslation(method, 2, TranslationKind.SUBSCRIPT_WRITE, null);
    }

    public static MethodTranslation remove(String method) {
        return new MethodTranslation(method, ANY_ARITY, TranslationKind.REMOVE, null);
    }

    /**
     * Returns true if this entry applies to a call with the given shape.
     *
     * @param name called method name
     * @param argumentCount number of arguments
     * @return true on match
     */
    public boolean matches(String name, int argumentCount) {
        return method.equals(name) && (arity == ANY_ARITY || arity == argumentCount);
    }
}
