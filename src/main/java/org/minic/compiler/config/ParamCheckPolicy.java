package org.minic.compiler.config;

/**
 * How many argument mismatches a single function call reports.
 */
public enum ParamCheckPolicy {
    /** Check every argument position and report each mismatch. */
    ALL,
    /** Stop at the first mismatched argument. */
    FIRST
}
