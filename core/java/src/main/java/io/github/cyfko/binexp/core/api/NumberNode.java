package io.github.cyfko.binexp.core.api;

import java.math.BigInteger;
import java.util.Objects;

/**
 * Integer leaf of an expression tree.
 *
 * @param value the integer value, arbitrary precision
 * @author Frank KOSSI
 * @since 1.0.0
 */
public record NumberNode(BigInteger value) implements Node {

    public NumberNode {
        Objects.requireNonNull(value, "Number value cannot be null");
    }

    public NumberNode(long value) {
        this(BigInteger.valueOf(value));
    }

    /**
     * @param other the value to compare with
     * @return {@code true} if this leaf holds exactly {@code other}
     */
    public boolean hasValue(BigInteger other) {
        return value.equals(other);
    }

    @Override
    public boolean isLeaf() {
        return true;
    }

    @Override
    public String toString() {
        return value.toString();
    }
}
