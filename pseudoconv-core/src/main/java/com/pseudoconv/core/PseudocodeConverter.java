package com.pseudoconv.core;

import com.pseudoconv.core.ast.Ast;
import com.pseudoconv.core.error.ConvertError;
import com.pseudoconv.core.error.ConvertException;
import com.pseudoconv.core.error.Stage;
import com.pseudoconv.core.error.StageResult;
import com.pseudoconv.core.generator.PseudocodeGenerator;
import com.pseudoconv.core.generator.StyleConfig;
import com.pseudoconv.core.generator.Styles;
import com.pseudoconv.core.lexer.Token;
import com.pseudoconv.core.lexer.Tokenizer;
import com.pseudoconv.core.normalize.SourceNormalizer;
import com.pseudoconv.core.parser.Parser;
import com.pseudoconv.core.scope.ScopeGuard;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * Entry point: converts Java-subset source text into pseudocode.
 *
 * <p>Runs the pipeline normalize, scope check, tokenize, parse, generate. Each
 * stage either hands its output to the next or ends the conversion with a
 * single positioned error; no partial output is ever returned.
 *
 * <p>The converter holds no per-call state and may be shared between threads.
 *
 * <p><b>Usage:</b>
 * <pre>{@code
 * PseudocodeConverter converter = new PseudocodeConverter();
 * ConvertResult result = converter.convert(source, ConvertOptions.forStyle(StyleId.SC_03));
 * if (result.isSuccess()) {
 *     System.out.println(result.pseudocode());
 * } else {
 *     result.errors().forEach(e -> System.err.println(e.toLine()));
 * }
 * }</pre>
 */
public final class PseudocodeConverter {

    private static final Logger log = LoggerFactory.getLogger(PseudocodeConverter.class);

    static final String EMPTY_INPUT = "Empty input";

    private static final ScopeGuard STANDARD_GUARD = new ScopeGuard(true);
    private static final ScopeGuard MINIMAL_GUARD = new ScopeGuard(false);

    /**
     * Converts with {@link ConvertOptions#defaults()}.
     *
     * @param source Java source text
     * @return pseudocode or errors
     */
    public ConvertResult convert(String source) {
        return convert(source, ConvertOptions.defaults());
    }

    /**
     * Converts source text.
     *
     * @param source Java source text, may be null
     * @param options conversion options
     * @return pseudocode or errors
     */
    public ConvertResult convert(String source, ConvertOptions options) {
        Objects.requireNonNull(options, "options must not be null");

        if (source == null || source.isBlank()) {
            log.debug("Rejecting blank input");
            return ConvertResult.failure(ConvertError.at(Stage.INPUT, EMPTY_INPUT));
        }

        String normalized = SourceNormalizer.normalize(source);

        ScopeGuard guard = options.allowMultiDimensionalArrays() ? STANDARD_GUARD : MINIMAL_GUARD;
        Optional<ConvertError> scopeError = guard.check(normalized);
        if (scopeError.isPresent()) {
            return fail(scopeError.get());
        }

        StageResult<List<Token>> tokens = Tokenizer.tokenize(normalized);
        if (!tokens.isSuccess()) {
            return fail(tokens.error());
        }
        log.debug("Tokenized {} tokens", tokens.value().size());

        StageResult<Ast.Program> program = Parser.parse(tokens.value());
        if (!program.isSuccess()) {
            return fail(program.error());
        }
        log.debug("Parsed {} top-level statements", program.value().statements().size());

        StyleConfig style = Styles.resolve(options.style());
        if (options.indentOverride() != null) {
            style = style.withIndent(options.indentOverride());
        }
        try {
            String pseudocode = new PseudocodeGenerator(style, options.unsupportedNodePolicy())
                .generate(program.value());
            return ConvertResult.success(pseudocode);
        } catch (ConvertException e) {
            return fail(e.getError());
        }
    }

    private static ConvertResult fail(ConvertError error) {
        log.debug("Conversion failed: {}", error.toLine());
        return ConvertResult.failure(error);
    }
}
