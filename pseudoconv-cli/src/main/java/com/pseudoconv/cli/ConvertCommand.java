package com.pseudoconv.cli;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.pseudoconv.core.ConvertOptions;
import com.pseudoconv.core.ConvertResult;
import com.pseudoconv.core.PseudocodeConverter;
import com.pseudoconv.core.config.ConfigLoader;
import com.pseudoconv.core.config.ProjectConfig;
import com.pseudoconv.core.error.ConvertError;
import com.pseudoconv.core.error.Stage;
import com.pseudoconv.core.generator.StyleId;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;
import picocli.CommandLine.Parameters;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.Callable;

/**
 * Command to convert Java source files to pseudocode.
 *
 * <p>Pseudocode goes to stdout. Errors go to stderr as one
 * {@code stage line:column message} line each, or as a JSON array with {@code --json}.
 * With several files, {@code --json} prints one object after all files are processed,
 * mapping each rejected or unreadable file to its error array. An unreadable file does
 * not stop the remaining files from converting.
 *
 * <p><b>Exit codes:</b>
 * <ul>
 *   <li>0 - every file converted</li>
 *   <li>1 - at least one file was rejected</li>
 *   <li>2 - a file could not be read, or the style is unknown (takes precedence over 1)</li>
 * </ul>
 *
 * <p><b>Usage:</b>
 * <pre>{@code
 * # Convert with the configured (or default) style
 * pseudoconv convert Main.java
 *
 * # Pick a style and get machine-readable errors
 * pseudoconv convert -s sc-06 --json Inventory.java
 * }</pre>
 */
@Command(
    name = "convert",
    description = "Convert Java source files to pseudocode",
    mixinStandardHelpOptions = true
)
public class ConvertCommand implements Callable<Integer> {

    static final int EXIT_OK = 0;
    static final int EXIT_REJECTED = 1;
    static final int EXIT_USAGE = 2;

    private static final Logger log = LoggerFactory.getLogger(ConvertCommand.class);
    private static final ObjectMapper JSON_MAPPER = new ObjectMapper();

    @Parameters(arity = "1..*", paramLabel = "FILE", description = "Java source files to convert")
    private List<Path> files;

    @Option(
        names = {"-s", "--style"},
        description = "Pseudocode style, sc-01 to sc-09 (overrides config)"
    )
    private String style;

    @Option(
        names = {"-c", "--config"},
        description = "Configuration file (default: pseudoconv.yaml)"
    )
    private Path configPath = Paths.get(ConfigLoader.DEFAULT_FILE_NAME);

    @Option(
        names = {"--json"},
        description = "Print errors as JSON"
    )
    private boolean json;

    private final PseudocodeConverter converter = new PseudocodeConverter();

    @Override
    public Integer call() {
        ConvertOptions options;
        try {
            options = resolveOptions();
        } catch (IllegalArgumentException e) {
            log.error("Invalid options: {}", e.getMessage());
            System.err.println("✗ " + e.getMessage());
            return EXIT_USAGE;
        }

        int exitCode = EXIT_OK;
        boolean multipleFiles = files.size() > 1;
        Map<String, List<ConvertError>> rejected = new LinkedHashMap<>();
        for (Path file : files) {
            String source;
            try {
                source = Files.readString(file, StandardCharsets.UTF_8);
            } catch (IOException e) {
                log.debug("Failed to read {}", file, e);
                if (json) {
                    rejected.put(file.toString(), List.of(new ConvertError(Stage.INPUT, "Cannot read file", 1, 1)));
                } else {
                    System.err.println("✗ Cannot read file: " + file);
                }
                exitCode = EXIT_USAGE;
                continue;
            }

            log.debug("Converting {} with style {}", file, options.style());
            ConvertResult result = converter.convert(source, options);
            if (result.isSuccess()) {
                if (multipleFiles) {
                    System.out.println("--- " + file + " ---");
                }
                System.out.println(result.pseudocode());
            } else {
                if (json) {
                    rejected.put(file.toString(), result.errors());
                } else {
                    printErrors(file, result.errors(), multipleFiles);
                }
                exitCode = Math.max(exitCode, EXIT_REJECTED);
            }
        }
        if (!rejected.isEmpty()) {
            printJson(multipleFiles ? rejected : rejected.values().iterator().next());
        }
        return exitCode;
    }

    private ConvertOptions resolveOptions() {
        ProjectConfig config = Files.exists(configPath) ? ConfigLoader.load(configPath) : ProjectConfig.defaults();
        ConvertOptions options = config.toOptions();
        if (style != null) {
            options = options.withStyle(StyleId.fromId(style));
        }
        return options;
    }

    private void printErrors(Path file, List<ConvertError> errors, boolean multipleFiles) {
        String prefix = multipleFiles ? file + ": " : "";
        for (ConvertError error : errors) {
            System.err.println(prefix + error.toLine());
        }
    }

    private void printJson(Object errors) {
        try {
            System.err.println(JSON_MAPPER.writerWithDefaultPrettyPrinter().writeValueAsString(errors));
        } catch (JsonProcessingException e) {
            log.error("Failed to serialize errors as JSON", e);
            System.err.println("✗ Failed to serialize errors: " + e.getOriginalMessage());
        }
    }
}
