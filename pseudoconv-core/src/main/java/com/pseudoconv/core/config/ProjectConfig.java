package com.pseudoconv.core.config;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.pseudoconv.core.ConvertOptions;
import com.pseudoconv.core.generator.StyleId;
import com.pseudoconv.core.generator.UnsupportedNodePolicy;

/**
 * Root configuration for pseudoconv.
 *
 * <p>Loaded from {@code pseudoconv.yaml}. Every section is optional; missing
 * values fall back to {@link ConvertOptions#defaults()}.
 *
 * <p><b>Example YAML:</b>
 * <pre>{@code
 * style: sc-03
 *
 * scope:
 *   allowMultiDimensionalArrays: false
 *
 * generator:
 *   unsupportedNodes: fail
 *   indent: 2
 * }</pre>
 *
 * @param style default style id
 * @param scope scope guard settings
 * @param generator generator settings
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record ProjectConfig(
    @JsonProperty("style") String style,
    @JsonProperty("scope") ScopeSettings scope,
    @JsonProperty("generator") GeneratorSettings generator
) {
    /**
     * Creates the default configuration.
     *
     * @return default configuration
     */
    public static ProjectConfig defaults() {
        return new ProjectConfig(
            StyleId.DEFAULT.id(),
            new ScopeSettings(true),
            new GeneratorSettings("placeholder", null)
        );
    }

    /**
     * Maps this configuration onto conversion options.
     *
     * @return conversion options
     * @throws IllegalArgumentException if the style id, policy name or indent is invalid
     */
    public ConvertOptions toOptions() {
        ConvertOptions options = ConvertOptions.defaults();
        if (style != null) {
            options = options.withStyle(StyleId.fromId(style));
        }
        if (scope != null && scope.allowMultiDimensionalArrays() != null) {
            options = options.withMultiDimensionalArrays(scope.allowMultiDimensionalArrays());
        }
        if (generator != null) {
            options = options.withUnsupportedNodePolicy(UnsupportedNodePolicy.fromId(generator.unsupportedNodes()))
                .withIndent(generator.indent());
        }
        return options;
    }

    /**
     * Scope guard settings.
     *
     * @param allowMultiDimensionalArrays false rejects {@code a[i][j]} before parsing
     */
    @JsonIgnoreProperties(ignoreUnknown = true)
    public record ScopeSettings(
        @JsonProperty("allowMultiDimensionalArrays") Boolean allowMultiDimensionalArrays
    ) {}

    /**
     * Generator settings.
     *
     * @param unsupportedNodes "placeholder" or "fail"
     * @param indent spaces per nesting level, overriding the style (optional)
     */
    @JsonIgnoreProperties(ignoreUnknown = true)
    public record GeneratorSettings(
        @JsonProperty("unsupportedNodes") String unsupportedNodes,
        @JsonProperty("indent") Integer indent
    ) {}
}
