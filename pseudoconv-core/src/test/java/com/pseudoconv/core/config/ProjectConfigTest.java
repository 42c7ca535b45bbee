package com.pseudoconv.core.config;

import com.pseudoconv.core.ConvertOptions;
import com.pseudoconv.core.generator.StyleId;
import com.pseudoconv.core.generator.UnsupportedNodePolicy;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Tests for {@link ProjectConfig}.
 */
class ProjectConfigTest {

    @Test
    void toOptions_defaults_matchDefaultOptions() {
        assertThat(ProjectConfig.defaults().toOptions()).isEqualTo(ConvertOptions.defaults());
    }

    @Test
    void toOptions_allSections_mapped() {
        ProjectConfig config = new ProjectConfig("SC-07",
            new ProjectConfig.ScopeSettings(false),
            new ProjectConfig.GeneratorSettings("FAIL", 2));

        ConvertOptions options = config.toOptions();

        assertThat(options.style()).isEqualTo(StyleId.SC_07);
        assertThat(options.allowMultiDimensionalArrays()).isFalse();
        assertThat(options.unsupportedNodePolicy()).isEqualTo(UnsupportedNodePolicy.FAIL);
        assertThat(options.indentOverride()).isEqualTo(2);
    }

    @Test
    void toOptions_missingSections_keepDefaults() {
        ConvertOptions options = new ProjectConfig(null, new ProjectConfig.ScopeSettings(null), null).toOptions();

        assertThat(options).isEqualTo(ConvertOptions.defaults());
    }

    @Test
    void toOptions_negativeIndent_rejected() {
        ProjectConfig config = new ProjectConfig(null, null, new ProjectConfig.GeneratorSettings(null, -1));

        assertThatThrownBy(config::toOptions).isInstanceOf(IllegalArgumentException.class);
    }
}
