package com.pseudoconv.core.generator;

/**
 * How a method call on a collection is rewritten. {@code r} is the receiver,
 * {@code a}, {@code b} the arguments.
 */
public enum TranslationKind {
    /** {@code r[a]} */
    SUBSCRIPT_READ,

    /** {@code r[a] = b} */
    SUBSCRIPT_WRITE,

    /** {@code r.alias(args)} */
    RENAME,

    /** {@code alias(r, args)} */
    FUNCTION_FORM,

    /** {@code remove r[a]} for keyed collections, {@code r.removeItemAt(args)} otherwise */
    REMOVE,

    /** {@code r.name(args)} */
    PASSTHROUGH
}
