package com.pseudoconv.core;

import com.pseudoconv.core.generator.StyleId;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvFileSource;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Golden-file conversions: each row of {@code golden/conversions.csv} holds a
 * style, a source program and the exact expected pseudocode, with {@code \n}
 * standing for a line break.
 */
class GoldenFileTest {

    private final PseudocodeConverter converter = new PseudocodeConverter();

    @ParameterizedTest(name = "{0} ({1})")
    @CsvFileSource(resources = "/golden/conversions.csv", numLinesToSkip = 1,
        delimiterString = "::", quoteCharacter = '\'')
    void convert_goldenCase_matchesExpected(String name, String style, String source, String expected) {
        ConvertResult result = converter.convert(unescape(source), ConvertOptions.forStyle(StyleId.fromId(style)));

        assertThat(result.errors()).as(name).isNull();
        assertThat(result.pseudocode()).isEqualTo(unescape(expected));
    }

    private static String unescape(String value) {
        return value.replace("\\n", "\n");
    }
}
