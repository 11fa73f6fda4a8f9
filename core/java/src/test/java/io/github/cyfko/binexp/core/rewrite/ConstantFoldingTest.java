package io.github.cyfko.binexp.core.rewrite;

import io.github.cyfko.binexp.core.api.Node;
import io.github.cyfko.binexp.core.api.NumberNode;
import io.github.cyfko.binexp.core.api.Op;
import io.github.cyfko.binexp.core.config.DivisionByZeroPolicy;
import io.github.cyfko.binexp.core.exception.DivisionByZeroException;
import io.github.cyfko.binexp.core.exception.ModuloByZeroException;
import io.github.cyfko.binexp.core.impl.PrefixExpressionParser;
import io.github.cyfko.binexp.core.parsing.NotationSerializer;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Test suite for {@link ConstantFolding}.
 *
 * @author Frank KOSSI
 * @since 1.0.0
 */
@DisplayName("ConstantFolding Tests")
class ConstantFoldingTest {

    private final PrefixExpressionParser parser = new PrefixExpressionParser();
    private final ConstantFolding folding = new ConstantFolding();

    private String fold(String prefix) {
        return NotationSerializer.toPrefix(folding.rewrite(parser.parse(prefix)).node());
    }

    @Nested
    @DisplayName("Arithmetic")
    class Arithmetic {

        @ParameterizedTest(name = "{0} -> {1}")
        @CsvSource({
            "+ 1 2, 3",
            "- 1 2, -1",
            "* 3 4, 12",
            "/ 7 2, 3",
            "/ -7 2, -4",
            "% -7 2, 1",
            "% 7 -2, -1",
            "- 0 5, -5",
            "+ 99999999999999999999 1, 100000000000000000000",
            "* 4294967296 4294967296, 18446744073709551616"
        })
        void shouldFoldLiteralOperations(String input, String expected) {
            assertEquals(expected, fold(input));
        }

        @Test
        @DisplayName("Should fold nested literal operations in a single bottom-up pass")
        void shouldFoldBottomUp() {
            RewriteResult result = folding.rewrite(parser.parse("* + 1 2 - 10 4"));

            assertTrue(result.changed());
            assertEquals(new NumberNode(18), result.node());
        }

        @ParameterizedTest(name = "{0} -> {1}")
        @CsvSource({
            "+ x 2, + x 2",
            "+ x + 1 2, + x 3",
            "* + 1 1 y, * 2 y",
            "x, x"
        })
        void shouldKeepOperationsOnVariables(String input, String expected) {
            assertEquals(expected, fold(input));
        }

        @Test
        void shouldReportNoChangeWithoutLiteralPairs() {
            Node tree = parser.parse("+ x y");

            RewriteResult result = folding.rewrite(tree);

            assertFalse(result.changed());
            assertSame(tree, result.node());
            assertEquals("constant-folding", folding.name());
        }
    }

    @Nested
    @DisplayName("Zero divisor")
    class ZeroDivisor {

        @Test
        void shouldFailOnDivisionByZeroByDefault() {
            DivisionByZeroException exception = assertThrows(
                DivisionByZeroException.class,
                () -> folding.rewrite(parser.parse("/ 5 0"))
            );

            assertEquals(Op.DIVIDE, exception.operator());
        }

        @Test
        void shouldFailOnModuloByZeroByDefault() {
            assertThrows(ModuloByZeroException.class, () -> folding.rewrite(parser.parse("+ 1 % 5 0")));
        }

        @Test
        void shouldNotFailWhenDividendIsVariable() {
            assertEquals("/ x 0", fold("/ x 0"));
        }

        @Test
        @DisplayName("LEAVE_UNFOLDED keeps the offending node and folds the rest")
        void shouldLeaveUnfoldedWhenLenient() {
            ConstantFolding lenient = new ConstantFolding(DivisionByZeroPolicy.LEAVE_UNFOLDED);

            RewriteResult result = lenient.rewrite(parser.parse("+ / 5 0 + 1 1"));

            assertTrue(result.changed());
            assertEquals("+ / 5 0 2", NotationSerializer.toPrefix(result.node()));
        }

        @Test
        void unfoldedNodeShouldNotCountAsChange() {
            ConstantFolding lenient = new ConstantFolding(DivisionByZeroPolicy.LEAVE_UNFOLDED);

            RewriteResult result = lenient.rewrite(parser.parse("% 5 0"));

            assertFalse(result.changed());
        }
    }

    @Test
    void shouldRequirePolicy() {
        assertThrows(NullPointerException.class, () -> new ConstantFolding(null));
    }
}
