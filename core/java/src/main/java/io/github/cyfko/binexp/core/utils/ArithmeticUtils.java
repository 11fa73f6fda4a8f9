package io.github.cyfko.binexp.core.utils;

import java.math.BigInteger;
import java.util.Objects;

/**
 * Integer helpers that {@link BigInteger} does not provide directly.
 * <p>
 * {@link BigInteger#divide(BigInteger)} truncates toward zero. The expression grammar uses
 * floor semantics instead, the same as {@link Math#floorDiv(long, long)} and
 * {@link Math#floorMod(long, long)} but without overflow.
 * </p>
 *
 * @author Frank KOSSI
 * @since 1.0.0
 */
public final class ArithmeticUtils {

    private ArithmeticUtils() {}

    /**
     * Divides rounding toward negative infinity.
     *
     * @param dividend the dividend
     * @param divisor  the divisor, must not be zero
     * @return the largest integer less than or equal to {@code dividend / divisor}
     * @throws ArithmeticException if {@code divisor} is zero
     */
    public static BigInteger floorDiv(BigInteger dividend, BigInteger divisor) {
        Objects.requireNonNull(dividend, "dividend cannot be null");
        Objects.requireNonNull(divisor, "divisor cannot be null");

        BigInteger[] qr = dividend.divideAndRemainder(divisor);
        // Truncated quotient is one too high when the remainder and divisor disagree in sign
        if (qr[1].signum() != 0 && qr[1].signum() != divisor.signum()) {
            return qr[0].subtract(BigInteger.ONE);
        }
        return qr[0];
    }

    /**
     * Modulo consistent with {@link #floorDiv(BigInteger, BigInteger)}: the result has the sign of the divisor.
     *
     * @param dividend the dividend
     * @param divisor  the divisor, must not be zero
     * @return {@code dividend - floorDiv(dividend, divisor) * divisor}
     * @throws ArithmeticException if {@code divisor} is zero
     */
    public static BigInteger floorMod(BigInteger dividend, BigInteger divisor) {
        Objects.requireNonNull(dividend, "dividend cannot be null");
        Objects.requireNonNull(divisor, "divisor cannot be null");

        BigInteger remainder = dividend.remainder(divisor);
        if (remainder.signum() != 0 && remainder.signum() != divisor.signum()) {
            return remainder.add(divisor);
        }
        return remainder;
    }
}
