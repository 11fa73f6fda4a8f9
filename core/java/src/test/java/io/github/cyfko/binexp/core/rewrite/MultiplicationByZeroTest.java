package io.github.cyfko.binexp.core.rewrite;

import io.github.cyfko.binexp.core.api.Node;
import io.github.cyfko.binexp.core.impl.PrefixExpressionParser;
import io.github.cyfko.binexp.core.parsing.NotationSerializer;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("MultiplicationByZero Tests")
class MultiplicationByZeroTest {

    private final PrefixExpressionParser parser = new PrefixExpressionParser();

    @ParameterizedTest
    @CsvSource({
        "* x 0, 0",
        "* 0 x, 0",
        "* + x y 0, 0",
        "* 0 / 1 0, 0",
        "+ y * x 0, + y 0",
        "- x * 0 z, - x 0",
        "* * x 0 y, 0",
        "* x 1, * x 1",
        "+ x 0, + x 0",
        "/ 0 x, / 0 x"
    })
    void shouldReplaceMultiplicationByZero(String input, String expected) {
        RewriteResult result = MultiplicationByZero.INSTANCE.rewrite(parser.parse(input));

        assertEquals(expected, NotationSerializer.toPrefix(result.node()));
        assertEquals(!input.equals(expected), result.changed());
    }

    @Test
    @DisplayName("Should discard the variable operand without evaluating it")
    void shouldDiscardOtherOperand() {
        Node tree = parser.parse("* - a b 0");

        RewriteResult result = MultiplicationByZero.INSTANCE.rewrite(tree);

        assertTrue(result.changed());
        assertEquals(1, result.node().size());
        assertEquals("multiplication-by-zero", MultiplicationByZero.INSTANCE.name());
    }
}
