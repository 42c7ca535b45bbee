package com.pseudoconv.core.generator;

import java.util.Locale;

/**
 * Keyword spellings of a pseudocode style.
 *
 * <p>Multi-word keywords carry their inner space ("else if", "end while").
 * Which loop keywords a generator uses depends on the style's {@link LoopForm}.
 *
 * @param ifKeyword opens a conditional
 * @param then ends a condition line
 * @param elseKeyword final branch
 * @param elseIf further condition branch
 * @param endIf closes a conditional
 * @param input console read
 * @param output console write
 * @param whileKeyword structured pre-tested loop
 * @param doKeyword ends a structured while line
 * @param endWhile closes a structured while
 * @param repeat opens a structured post-tested loop
 * @param until closes a post-tested loop (both forms)
 * @param forKeyword structured counting loop
 * @param endFor closes a structured for
 * @param loop opens a loop-form loop
 * @param loopWhile loop-form pre-tested loop
 * @param endLoop closes a loop-form loop
 */
public record StyleKeywords(
    String ifKeyword,
    String then,
    String elseKeyword,
    String elseIf,
    String endIf,
    String input,
    String output,
    String whileKeyword,
    String doKeyword,
    String endWhile,
    String repeat,
    String until,
    String forKeyword,
    String endFor,
    String loop,
    String loopWhile,
    String endLoop
) {

    /**
     * Lowercase spellings shared by every lowercase style.
     *
     * @return lowercase keywords
     */
    public static StyleKeywords lowercase() {
        return new StyleKeywords(
            "if", "then", "else", "else if", "end if",
            "input", "output",
            "while", "do", "end while",
            "repeat", "until",
            "for", "end for",
            "loop", "loop while", "end loop"
        );
    }

    /**
     * Returns a copy with every keyword in uppercase.
     *
     * @return uppercase keywords
     */
    public StyleKeywords uppercased() {
        return new StyleKeywords(
            upper(ifKeyword), upper(then), upper(elseKeyword), upper(elseIf), upper(endIf),
            upper(input), upper(output),
            upper(whileKeyword), upper(doKeyword), upper(endWhile),
            upper(repeat), upper(until),
            upper(forKeyword), upper(endFor),
            upper(loop), upper(loopWhile), upper(endLoop)
        );
    }

    private static String upper(String keyword) {
        return keyword.toUpperCase(Locale.ROOT);
    }
}
