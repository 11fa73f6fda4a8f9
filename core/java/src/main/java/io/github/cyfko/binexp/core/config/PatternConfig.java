package io.github.cyfko.binexp.core.config;

import java.util.regex.Pattern;

/**
 * Pre-compiled patterns used to classify expression tokens.
 *
 * @author Frank KOSSI
 * @since 1.0.0
 */
public abstract class PatternConfig {
    private PatternConfig() {}

    /**
     * Integer literal: optional leading minus followed by one or more ASCII digits.
     * Example valid: "0", "42", "-7". Example invalid: "+3", "1.5", "-".
     */
    public static final Pattern NUMBER_PATTERN = Pattern.compile("^-?[0-9]+$");

    /**
     * Variable name: one or more alphabetic characters.
     * Example valid: "x", "total", "Δ". Example invalid: "x1", "_x", "my_var".
     */
    public static final Pattern VARIABLE_PATTERN = Pattern.compile("^\\p{IsAlphabetic}+$");
}
