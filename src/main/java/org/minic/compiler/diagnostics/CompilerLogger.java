package org.minic.compiler.diagnostics;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Compiler-internal logging facade with its own verbosity gate in front of SLF4J.
 * <p>
 * The gate lets a build run quietly (for example inside tests or an IDE integration)
 * without touching the global Logback configuration. Messages that pass the gate are
 * still subject to the SLF4J backend's own levels.
 */
public final class CompilerLogger {

    /**
     * Verbosity levels, from least to most chatty.
     */
    public enum Verbosity {
        ERROR, WARN, INFO, DEBUG, TRACE
    }

    private static final Logger logger = LoggerFactory.getLogger(CompilerLogger.class);
    private static volatile Verbosity verbosity = Verbosity.INFO;

    private CompilerLogger() {}

    /**
     * Sets the verbosity gate.
     * @param newVerbosity The new verbosity; {@code null} is ignored.
     */
    public static void setVerbosity(Verbosity newVerbosity) {
        if (newVerbosity != null) {
            verbosity = newVerbosity;
        }
    }

    /**
     * @return The current verbosity gate.
     */
    public static Verbosity getVerbosity() {
        return verbosity;
    }

    private static boolean enabled(Verbosity required) {
        return verbosity.compareTo(required) >= 0;
    }

    /**
     * Logs a detected semantic error. Diagnostics are data first; this only traces them.
     * @param diagnostic The diagnostic that was just recorded.
     */
    public static void diagnostic(Diagnostic diagnostic) {
        if (enabled(Verbosity.DEBUG)) logger.debug("{} ({})", diagnostic, diagnostic.kind());
    }

    public static void info(String msg) {
        if (enabled(Verbosity.INFO)) logger.info(msg);
    }

    public static void debug(String msg) {
        if (enabled(Verbosity.DEBUG)) logger.debug(msg);
    }

    public static void trace(String msg) {
        if (enabled(Verbosity.TRACE)) logger.trace(msg);
    }
}
