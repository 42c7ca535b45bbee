package com.pseudoconv.cli;

import com.pseudoconv.core.generator.LoopForm;
import com.pseudoconv.core.generator.StyleConfig;
import com.pseudoconv.core.generator.StyleId;
import com.pseudoconv.core.generator.Styles;
import picocli.CommandLine.Command;

import java.util.concurrent.Callable;

/**
 * Command to list the available pseudocode styles.
 *
 * <p><b>Usage:</b>
 * <pre>{@code
 * pseudoconv styles
 * }</pre>
 */
@Command(
    name = "styles",
    description = "List available pseudocode styles",
    mixinStandardHelpOptions = true
)
public class StylesCommand implements Callable<Integer> {

    @Override
    public Integer call() {
        System.out.println("Available Styles:");
        System.out.println();

        for (StyleId id : StyleId.values()) {
            StyleConfig style = Styles.resolve(id);
            System.out.printf("  • %s%s%n", id.id(), id == StyleId.DEFAULT ? " (default)" : "");
            System.out.printf("    Loops: %s%n", describeLoops(style));
            System.out.printf("    Keywords: %s, not-equal %s, modulo %s, indent %d%n",
                style.keywords().ifKeyword(), style.notEqual(), style.modulo(), style.indentWidth());
        }
        return 0;
    }

    private static String describeLoops(StyleConfig style) {
        if (style.loopForm() == LoopForm.LOOP) {
            return style.keywords().loopWhile() + " / " + style.keywords().loop() + " ... " + style.keywords().until();
        }
        return style.keywords().whileKeyword() + " / " + style.keywords().repeat() + " ... "
            + style.keywords().until() + " / " + style.keywords().forKeyword();
    }
}
