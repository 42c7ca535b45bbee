package com.pseudoconv.core.normalize;

/**
 * Canonicalizes raw source text before any other stage sees it.
 *
 * <p>Normalization never fails and keeps every surviving character on the same
 * line and column it had after line-ending and tab canonicalization:
 * <ul>
 *   <li>{@code \r\n} and lone {@code \r} become {@code \n}</li>
 *   <li>each tab becomes {@value #TAB_WIDTH} spaces</li>
 *   <li>line and block comments are overwritten with spaces, newlines inside
 *       block comments are kept</li>
 *   <li>string and char literals are copied verbatim, escapes included</li>
 * </ul>
 *
 * <p><b>Usage:</b>
 * <pre>{@code
 * String normalized = SourceNormalizer.normalize("int x = 1; // counter");
 * // "int x = 1;           "
 * }</pre>
 */
public final class SourceNormalizer {

    /** Number of spaces a tab expands to. */
    public static final int TAB_WIDTH = 2;

    private static final String TAB_SPACES = " ".repeat(TAB_WIDTH);

    private SourceNormalizer() {
        // Utility class
    }

    /**
     * Normalizes line endings and tabs and blanks out comments.
     *
     * @param source raw source text
     * @return normalized text
     */
    public static String normalize(String source) {
        String text = source
            .replace("\r\n", "\n")
            .replace('\r', '\n')
            .replace("\t", TAB_SPACES);

        StringBuilder out = new StringBuilder(text.length());
        int i = 0;
        while (i < text.length()) {
            char ch = text.charAt(i);
            char next = i + 1 < text.length() ? text.charAt(i + 1) : '\0';

            if (ch == '"' || ch == '\'') {
                i = copyLiteral(text, i, out, false);
                continue;
            }

            if (ch == '/' && next == '/') {
                while (i < text.length() && text.charAt(i) != '\n') {
                    out.append(' ');
                    i++;
                }
                continue;
            }

            if (ch == '/' && next == '*') {
                out.append("  ");
                i += 2;
                while (i < text.length()) {
                    if (text.charAt(i) == '*' && i + 1 < text.length() && text.charAt(i + 1) == '/') {
                        out.append("  ");
                        i += 2;
                        break;
                    }
                    out.append(text.charAt(i) == '\n' ? '\n' : ' ');
                    i++;
                }
                continue;
            }

            out.append(ch);
            i++;
        }
        return out.toString();
    }

    /**
     * Returns a same-length copy of normalized text whose string and char literal
     * contents are replaced by spaces. Quotes and newlines are kept.
     *
     * <p>Used by the scope guard so that banned words inside literals cannot
     * trigger a rule.
     *
     * @param normalized text previously produced by {@link #normalize(String)}
     * @return masked text
     */
    public static String maskStringLiterals(String normalized) {
        StringBuilder out = new StringBuilder(normalized.length());
        int i = 0;
        while (i < normalized.length()) {
            char ch = normalized.charAt(i);
            if (ch == '"' || ch == '\'') {
                i = copyLiteral(normalized, i, out, true);
                continue;
            }
            out.append(ch);
            i++;
        }
        return out.toString();
    }

    /**
     * Copies a literal starting at its opening quote. The literal ends at the
     * matching quote, or at end of input when unterminated.
     *
     * @return index just past the copied literal
     */
    private static int copyLiteral(String text, int start, StringBuilder out, boolean mask) {
        char quote = text.charAt(start);
        out.append(quote);
        int i = start + 1;
        while (i < text.length()) {
            char c = text.charAt(i);
            if (c == '\\' && i + 1 < text.length()) {
                out.append(maskChar(c, mask)).append(maskChar(text.charAt(i + 1), mask));
                i += 2;
                continue;
            }
            if (c == quote) {
                out.append(c);
                return i + 1;
            }
            out.append(maskChar(c, mask));
            i++;
        }
        return i;
    }

    private static char maskChar(char c, boolean mask) {
        if (!mask || c == '\n') {
            return c;
        }
        return ' ';
    }
}
