package org.minic.compiler.config;

import com.typesafe.config.Config;
import com.typesafe.config.ConfigException;
import org.minic.compiler.diagnostics.CompilerLogger;

import java.util.Locale;
import java.util.Objects;

/**
 * Settings that influence how the front end validates and reports.
 *
 * <h3>Configuration Structure:</h3>
 * <pre>
 * minic.compiler {
 *   param-check = "all"   # "all" or "first"
 *   verbosity = "info"    # error, warn, info, debug or trace
 * }
 * </pre>
 *
 * @param paramCheck How many argument mismatches a call reports.
 * @param verbosity The compiler logger's verbosity gate.
 */
public record CompilerSettings(ParamCheckPolicy paramCheck, CompilerLogger.Verbosity verbosity) {

    static final String COMPILER_CONFIG_PATH = "minic.compiler";
    private static final String PARAM_CHECK_KEY = "param-check";
    private static final String VERBOSITY_KEY = "verbosity";

    public CompilerSettings {
        Objects.requireNonNull(paramCheck, "paramCheck");
        Objects.requireNonNull(verbosity, "verbosity");
    }

    /**
     * @return The built-in defaults, matching {@code reference.conf}.
     */
    public static CompilerSettings defaults() {
        return new CompilerSettings(ParamCheckPolicy.ALL, CompilerLogger.Verbosity.INFO);
    }

    /**
     * Reads the {@code minic.compiler} section. Missing keys fall back to the defaults.
     *
     * @param config The resolved application configuration.
     * @return The settings.
     * @throws IllegalArgumentException if a value is not one of the allowed choices.
     */
    public static CompilerSettings fromConfig(Config config) {
        CompilerSettings defaults = defaults();
        if (!config.hasPath(COMPILER_CONFIG_PATH)) {
            return defaults;
        }
        Config section = config.getConfig(COMPILER_CONFIG_PATH);
        ParamCheckPolicy paramCheck = section.hasPath(PARAM_CHECK_KEY)
                ? parse(ParamCheckPolicy.class, section, PARAM_CHECK_KEY)
                : defaults.paramCheck();
        CompilerLogger.Verbosity verbosity = section.hasPath(VERBOSITY_KEY)
                ? parse(CompilerLogger.Verbosity.class, section, VERBOSITY_KEY)
                : defaults.verbosity();
        return new CompilerSettings(paramCheck, verbosity);
    }

    private static <E extends Enum<E>> E parse(Class<E> type, Config section, String key) {
        final String raw;
        try {
            raw = section.getString(key);
        } catch (ConfigException.WrongType e) {
            throw new IllegalArgumentException("Invalid value for " + COMPILER_CONFIG_PATH + "." + key, e);
        }
        try {
            return Enum.valueOf(type, raw.trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException e) {
            throw new IllegalArgumentException(
                    "Invalid value '" + raw + "' for " + COMPILER_CONFIG_PATH + "." + key, e);
        }
    }

    /**
     * Applies the process-wide parts of these settings.
     */
    public void apply() {
        CompilerLogger.setVerbosity(verbosity);
    }
}
