package com.pseudoconv;

import com.pseudoconv.cli.ConvertCommand;
import com.pseudoconv.cli.StylesCommand;
import picocli.CommandLine;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import ch.qos.logback.classic.Level;

/**
 * Main CLI entry point for pseudoconv.
 *
 * <p>Converts programs written in a restricted Java subset into instructional pseudocode.
 *
 * <p><b>Commands:</b>
 * <ul>
 *   <li>{@code convert} - Convert Java source files to pseudocode</li>
 *   <li>{@code styles} - List the available pseudocode styles</li>
 * </ul>
 *
 * <p><b>Global Options:</b>
 * <ul>
 *   <li>{@code -v, --verbose} - Enable verbose output</li>
 *   <li>{@code -q, --quiet} - Suppress all output except errors</li>
 *   <li>{@code --help} - Show help information</li>
 *   <li>{@code --version} - Show version information</li>
 * </ul>
 *
 * <p><b>Example Usage:</b>
 * <pre>{@code
 * # Convert with the default style
 * pseudoconv convert Main.java
 *
 * # Convert with loop-form keywords and debug logging
 * pseudoconv -v convert -s sc-03 Main.java
 *
 * # List styles
 * pseudoconv styles
 * }</pre>
 */
@Command(
    name = "pseudoconv",
    mixinStandardHelpOptions = true,
    version = "pseudoconv 1.0.0-SNAPSHOT",
    description = "Java subset to pseudocode converter",
    subcommands = {
        ConvertCommand.class,
        StylesCommand.class
    }
)
public class PseudoconvCLI implements Runnable {

    private static final Logger log = LoggerFactory.getLogger(PseudoconvCLI.class);

    @Option(names = {"-v", "--verbose"}, description = "Enable verbose output (DEBUG level)")
    private boolean verbose;

    @Option(names = {"-q", "--quiet"}, description = "Suppress all output except errors")
    private boolean quiet;

    @Override
    public void run() {
        if (quiet) {
            return;
        }

        System.out.println("pseudoconv - Java subset to pseudocode converter");
        System.out.println("Version: 1.0.0-SNAPSHOT");
        System.out.println();
        System.out.println("Use 'pseudoconv --help' to see available commands");
        System.out.println("Use 'pseudoconv <command> --help' for command-specific help");
    }

    /**
     * Configures logging level based on global options.
     */
    void configureLogging() {
        ch.qos.logback.classic.Logger root =
            (ch.qos.logback.classic.Logger) LoggerFactory.getLogger(Logger.ROOT_LOGGER_NAME);

        if (quiet) {
            root.setLevel(Level.ERROR);
        } else if (verbose) {
            root.setLevel(Level.DEBUG);
        } else {
            root.setLevel(Level.INFO);
        }
        log.debug("Verbose logging enabled");
    }

    /**
     * Returns whether verbose mode is enabled.
     *
     * @return true if verbose mode is enabled
     */
    public boolean isVerbose() {
        return verbose;
    }

    /**
     * Returns whether quiet mode is enabled.
     *
     * @return true if quiet mode is enabled
     */
    public boolean isQuiet() {
        return quiet;
    }

    /**
     * Builds the command line with logging configured before any subcommand runs.
     *
     * @return configured command line
     */
    public static CommandLine commandLine() {
        PseudoconvCLI cli = new PseudoconvCLI();
        CommandLine commandLine = new CommandLine(cli);
        commandLine.setExecutionStrategy(parseResult -> {
            cli.configureLogging();
            return new CommandLine.RunLast().execute(parseResult);
        });
        return commandLine;
    }

    /**
     * Main entry point.
     *
     * @param args command-line arguments
     */
    public static void main(String[] args) {
        int exitCode = commandLine().execute(args);
        System.exit(exitCode);
    }
}
