package org.minic.compiler.config;

import com.typesafe.config.Config;
import com.typesafe.config.ConfigFactory;
import org.minic.compiler.diagnostics.CompilerLogger;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

@Tag("unit")
class CompilerSettingsTest {

    @Test
    void missingSectionGivesDefaults() {
        assertThat(CompilerSettings.fromConfig(ConfigFactory.empty())).isEqualTo(CompilerSettings.defaults());
    }

    @Test
    void readsPolicyAndVerbosity() {
        Config config = ConfigFactory.parseString("minic.compiler { param-check = first, verbosity = DEBUG }");

        CompilerSettings settings = CompilerSettings.fromConfig(config);

        assertThat(settings.paramCheck()).isEqualTo(ParamCheckPolicy.FIRST);
        assertThat(settings.verbosity()).isEqualTo(CompilerLogger.Verbosity.DEBUG);
    }

    @Test
    void partialSectionKeepsOtherDefaults() {
        Config config = ConfigFactory.parseString("minic.compiler.verbosity = trace");

        CompilerSettings settings = CompilerSettings.fromConfig(config);

        assertThat(settings.paramCheck()).isEqualTo(ParamCheckPolicy.ALL);
        assertThat(settings.verbosity()).isEqualTo(CompilerLogger.Verbosity.TRACE);
    }

    @Test
    void unknownValueIsRejected() {
        Config config = ConfigFactory.parseString("minic.compiler.param-check = some");

        assertThatThrownBy(() -> CompilerSettings.fromConfig(config))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("minic.compiler.param-check");
    }

    @Test
    void nonStringValueIsRejected() {
        Config config = ConfigFactory.parseString("minic.compiler.verbosity { level = 1 }");

        assertThatThrownBy(() -> CompilerSettings.fromConfig(config))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("minic.compiler.verbosity");
    }

    @Test
    void applySetsLoggerVerbosity() {
        CompilerLogger.Verbosity before = CompilerLogger.getVerbosity();
        try {
            new CompilerSettings(ParamCheckPolicy.ALL, CompilerLogger.Verbosity.ERROR).apply();
            assertThat(CompilerLogger.getVerbosity()).isEqualTo(CompilerLogger.Verbosity.ERROR);
        } finally {
            CompilerLogger.setVerbosity(before);
        }
    }
}
