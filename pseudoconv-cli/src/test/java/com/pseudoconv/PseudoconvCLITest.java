package com.pseudoconv;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import picocli.CommandLine;

import java.io.ByteArrayOutputStream;
import java.io.PrintStream;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Tests for {@link PseudoconvCLI}.
 */
class PseudoconvCLITest {

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
    void execute_noSubcommand_printsBanner() {
        int exitCode = PseudoconvCLI.commandLine().execute();

        assertThat(exitCode).isZero();
        assertThat(outputStream.toString()).contains("pseudoconv - Java subset to pseudocode converter");
    }

    @Test
    void execute_quiet_printsNothing() {
        int exitCode = PseudoconvCLI.commandLine().execute("-q");

        assertThat(exitCode).isZero();
        assertThat(outputStream.toString()).isEmpty();
    }

    @Test
    void execute_version_printsVersion() {
        int exitCode = PseudoconvCLI.commandLine().execute("--version");

        assertThat(exitCode).isZero();
        assertThat(outputStream.toString()).contains("pseudoconv 1.0.0-SNAPSHOT");
    }

    @Test
    void parse_verboseFlag_setsVerbose() {
        PseudoconvCLI cli = new PseudoconvCLI();
        new CommandLine(cli).parseArgs("-v", "styles");

        assertThat(cli.isVerbose()).isTrue();
        assertThat(cli.isQuiet()).isFalse();
    }
}
