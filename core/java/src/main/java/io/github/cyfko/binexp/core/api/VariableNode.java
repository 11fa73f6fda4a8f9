package io.github.cyfko.binexp.core.api;

import io.github.cyfko.binexp.core.config.PatternConfig;

/**
 * Opaque identifier leaf of an expression tree.
 * <p>
 * Variables are never evaluated; rewrite rules only ever keep or discard them whole.
 * The name must consist of alphabetic characters only, so that any tree renders to prefix
 * text that parses back to the same tree.
 * </p>
 *
 * @param name the identifier
 * @author Frank KOSSI
 * @since 1.0.0
 */
public record VariableNode(String name) implements Node {

    public VariableNode {
        if (name == null || !PatternConfig.VARIABLE_PATTERN.matcher(name).matches()) {
            throw new IllegalArgumentException("Variable name must be alphabetic, got: " + name);
        }
    }

    @Override
    public boolean isLeaf() {
        return true;
    }

    @Override
    public String toString() {
        return name;
    }
}
