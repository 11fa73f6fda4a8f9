package io.github.cyfko.binexp.core.utils;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

import java.math.BigInteger;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("ArithmeticUtils Tests")
class ArithmeticUtilsTest {

    @ParameterizedTest(name = "floorDiv({0}, {1}) = {2}")
    @CsvSource({
        "7, 2, 3",
        "-7, 2, -4",
        "7, -2, -4",
        "-7, -2, 3",
        "6, 3, 2",
        "-6, 3, -2",
        "0, 5, 0",
        "1, 2, 0",
        "-1, 2, -1"
    })
    void shouldDivideTowardNegativeInfinity(long dividend, long divisor, long expected) {
        BigInteger result = ArithmeticUtils.floorDiv(BigInteger.valueOf(dividend), BigInteger.valueOf(divisor));

        assertEquals(BigInteger.valueOf(expected), result);
        assertEquals(Math.floorDiv(dividend, divisor), result.longValueExact());
    }

    @ParameterizedTest(name = "floorMod({0}, {1}) = {2}")
    @CsvSource({
        "7, 2, 1",
        "-7, 2, 1",
        "7, -2, -1",
        "-7, -2, -1",
        "6, 3, 0",
        "-6, 3, 0",
        "0, 5, 0"
    })
    void shouldTakeSignOfDivisor(long dividend, long divisor, long expected) {
        BigInteger result = ArithmeticUtils.floorMod(BigInteger.valueOf(dividend), BigInteger.valueOf(divisor));

        assertEquals(BigInteger.valueOf(expected), result);
        assertEquals(Math.floorMod(dividend, divisor), result.longValueExact());
    }

    @Test
    @DisplayName("Should not overflow beyond long range")
    void shouldHandleValuesBeyondLong() {
        BigInteger big = new BigInteger("-100000000000000000001");

        assertEquals(new BigInteger("-50000000000000000001"), ArithmeticUtils.floorDiv(big, BigInteger.TWO));
        assertEquals(BigInteger.ONE, ArithmeticUtils.floorMod(big, BigInteger.TWO));
    }

    @Test
    @DisplayName("Should reject zero divisor")
    void shouldRejectZeroDivisor() {
        assertThrows(ArithmeticException.class, () -> ArithmeticUtils.floorDiv(BigInteger.ONE, BigInteger.ZERO));
        assertThrows(ArithmeticException.class, () -> ArithmeticUtils.floorMod(BigInteger.ONE, BigInteger.ZERO));
    }
}
