package com.pseudoconv.core.error;

import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Tests for {@link ConvertError}, {@link StageResult} and {@link ConvertException}.
 */
class ConvertErrorTest {

    @Test
    void toLine_formatsStagePositionAndMessage() {
        ConvertError error = new ConvertError(Stage.PARSE, "Expected ';' after assignment", 3, 14);

        assertThat(error.toLine()).isEqualTo("parse 3:14 Expected ';' after assignment");
    }

    @Test
    void constructor_nonPositivePosition_clampsToOne() {
        ConvertError error = new ConvertError(Stage.SCOPE, "Switch is out of scope.", 0, -4);

        assertThat(error.line()).isEqualTo(1);
        assertThat(error.column()).isEqualTo(1);
    }

    @Test
    void at_createsErrorAtOrigin() {
        ConvertError error = ConvertError.at(Stage.INPUT, "Empty input");

        assertThat(error).isEqualTo(new ConvertError(Stage.INPUT, "Empty input", 1, 1));
    }

    @Test
    void serialization_writesStageIdAndFieldsInOrder() throws Exception {
        String json = new ObjectMapper().writeValueAsString(
            new ConvertError(Stage.TOKENIZATION, "Unsupported character '#'", 2, 7));

        assertThat(json).isEqualTo(
            "{\"stage\":\"tokenization\",\"message\":\"Unsupported character '#'\",\"line\":2,\"column\":7}");
    }

    @Test
    void stageResult_requiresExactlyOneSide() {
        assertThat(StageResult.ok("value").isSuccess()).isTrue();
        assertThat(StageResult.failed(ConvertError.at(Stage.PARSE, "x")).isSuccess()).isFalse();
        assertThatThrownBy(() -> new StageResult<>(null, null))
            .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> new StageResult<>("value", ConvertError.at(Stage.PARSE, "x")))
            .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void convertException_carriesErrorAndMessage() {
        ConvertException exception = new ConvertException(Stage.GENERATION, "Unsupported node Block", 1, 1);

        assertThat(exception.getError().stage()).isEqualTo(Stage.GENERATION);
        assertThat(exception).hasMessage("Unsupported node Block");
    }
}
