package org.minic.compiler.config;

import com.typesafe.config.Config;
import com.typesafe.config.ConfigFactory;
import org.minic.compiler.diagnostics.CompilerLogger;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.File;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;

import static org.assertj.core.api.Assertions.assertThat;

@Tag("unit")
class ConfigLoaderTest {

    @TempDir
    Path tempDir;

    @Test
    void fallsBackToReferenceConf() {
        Config config = ConfigLoader.load(tempDir.resolve("absent.conf").toFile());

        assertThat(config.getString("minic.compiler.param-check")).isEqualTo("all");
        assertThat(config.getString("logging.default-level")).isEqualTo("WARN");
        assertThat(CompilerSettings.fromConfig(config)).isEqualTo(CompilerSettings.defaults());
    }

    @Test
    void fileOverridesReferenceConf() throws IOException {
        File file = tempDir.resolve(ConfigLoader.CONFIG_FILE_NAME).toFile();
        Files.writeString(file.toPath(), "minic.compiler.param-check = first\n", StandardCharsets.UTF_8);

        Config config = ConfigLoader.load(file);

        assertThat(CompilerSettings.fromConfig(config).paramCheck()).isEqualTo(ParamCheckPolicy.FIRST);
        assertThat(config.getString("minic.compiler.verbosity")).isEqualTo("info");
    }

    @Test
    void systemPropertiesOverrideTheFile() throws IOException {
        File file = tempDir.resolve(ConfigLoader.CONFIG_FILE_NAME).toFile();
        Files.writeString(file.toPath(), "minic.compiler.verbosity = warn\n", StandardCharsets.UTF_8);
        String key = "minic.compiler.verbosity";
        System.setProperty(key, "debug");
        ConfigFactory.invalidateCaches();
        try {
            Config config = ConfigLoader.load(file);
            assertThat(config.getString(key)).isEqualTo("debug");
        } finally {
            System.clearProperty(key);
            ConfigFactory.invalidateCaches();
        }
    }

    @Test
    void loadSettingsAppliesVerbosity() {
        CompilerLogger.Verbosity before = CompilerLogger.getVerbosity();
        CompilerLogger.setVerbosity(CompilerLogger.Verbosity.TRACE);
        try {
            CompilerSettings settings = ConfigLoader.loadSettings();
            assertThat(settings.verbosity()).isEqualTo(CompilerLogger.getVerbosity());
        } finally {
            CompilerLogger.setVerbosity(before);
            LoggingConfigurator.reset();
        }
    }
}
