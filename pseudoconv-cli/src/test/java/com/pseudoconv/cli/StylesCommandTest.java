package com.pseudoconv.cli;

import com.pseudoconv.PseudoconvCLI;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.io.ByteArrayOutputStream;
import java.io.PrintStream;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Tests for {@link StylesCommand}.
 */
class StylesCommandTest {

    private final PrintStream originalOut = System.out;
    private ByteArrayOutputStream outputStream;

    @BeforeEach
    void setUp() {
        outputStream = new ByteArrayOutputStream();
        System.setOut(new PrintStream(outputStream));
    }

    @AfterEach
    void tearDown() {
        System.setOut(originalOut);
    }

    @Test
    void call_listsEveryStyle() {
        int exitCode = PseudoconvCLI.commandLine().execute("styles");

        String output = outputStream.toString();
        assertThat(exitCode).isZero();
        assertThat(output).startsWith("Available Styles:");
        for (int i = 1; i <= 9; i++) {
            assertThat(output).contains("sc-0" + i);
        }
    }

    @Test
    void call_marksDefaultStyle() {
        PseudoconvCLI.commandLine().execute("styles");

        assertThat(outputStream.toString()).contains("sc-02 (default)");
    }

    @Test
    void call_describesLoopsAndKeywords() {
        PseudoconvCLI.commandLine().execute("styles");

        String output = outputStream.toString();
        assertThat(output).contains("Loops: loop while / loop ... until");
        assertThat(output).contains("Loops: WHILE / REPEAT ... UNTIL / FOR");
        assertThat(output).contains("Keywords: if, not-equal <>, modulo mod, indent 4");
    }
}
