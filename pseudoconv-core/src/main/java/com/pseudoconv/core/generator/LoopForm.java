package com.pseudoconv.core.generator;

/**
 * Loop vocabulary of a style.
 */
public enum LoopForm {
    /** {@code while ... do / end while}, {@code repeat ... until}, {@code for ... end for} */
    STRUCTURED,

    /** {@code loop while ... / end loop}, {@code loop ... until}, {@code loop i from a to b} */
    LOOP
}
