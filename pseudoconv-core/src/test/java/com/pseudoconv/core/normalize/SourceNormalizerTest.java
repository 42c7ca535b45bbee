package com.pseudoconv.core.normalize;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Tests for {@link SourceNormalizer}.
 */
class SourceNormalizerTest {

    @Test
    void normalize_lineComment_replacedBySpacesOfSameLength() {
        String source = "int x = 1; // counter\nx++;";

        String normalized = SourceNormalizer.normalize(source);

        assertThat(normalized).isEqualTo("int x = 1;           \nx++;");
        assertThat(normalized).hasSameSizeAs(source);
    }

    @Test
    void normalize_blockComment_keepsNewlines() {
        String normalized = SourceNormalizer.normalize("a/* one\ntwo */b");

        assertThat(normalized).isEqualTo("a      \n      b");
    }

    @Test
    void normalize_unterminatedBlockComment_blanksToEnd() {
        String normalized = SourceNormalizer.normalize("x = 1; /* never closed\ny = 2;");

        assertThat(normalized).isEqualTo("x = 1;                \n      ");
    }

    @ParameterizedTest
    @ValueSource(strings = {
        "String s = \"http://example.com\";",
        "String s = \"/* not a comment */\";",
        "String s = \"say \\\"hi\\\" // still string\";",
        "char c = '/';"
    })
    void normalize_commentMarkersInsideLiterals_untouched(String source) {
        assertThat(SourceNormalizer.normalize(source)).isEqualTo(source);
    }

    @Test
    void normalize_lineEndings_convertedToLineFeed() {
        assertThat(SourceNormalizer.normalize("a\r\nb\rc\n")).isEqualTo("a\nb\nc\n");
    }

    @Test
    void normalize_tab_expandsToTwoSpaces() {
        assertThat(SourceNormalizer.normalize("\tx = 1;")).isEqualTo("  x = 1;");
    }

    @Test
    void maskStringLiterals_blanksContentsButKeepsQuotes() {
        String masked = SourceNormalizer.maskStringLiterals("s = \"try it\"; c = 'x';");

        assertThat(masked).isEqualTo("s = \"      \"; c = ' ';");
    }

    @Test
    void maskStringLiterals_escapedQuote_staysInsideLiteral() {
        String masked = SourceNormalizer.maskStringLiterals("s = \"a\\\"switch\"; switch");

        assertThat(masked).isEqualTo("s = \"         \"; switch");
    }
}
