package io.github.cyfko.binexp.core.rewrite;

import io.github.cyfko.binexp.core.api.Node;
import io.github.cyfko.binexp.core.api.NumberNode;
import io.github.cyfko.binexp.core.api.VariableNode;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("RewriteResult Tests")
class RewriteResultTest {

    private final Node x = new VariableNode("x");
    private final Node zero = new NumberNode(0);

    @Test
    @DisplayName("Merge should report a change when any step changed")
    void mergeShouldReportAnyChange() {
        // Given
        RewriteResult left = RewriteResult.unchanged(x);
        RewriteResult right = RewriteResult.changed(zero);
        RewriteResult self = RewriteResult.unchanged(x);

        // When
        RewriteResult merged = RewriteResult.merge(x, left, right, self);

        // Then
        assertTrue(merged.changed());
        assertSame(x, merged.node());
    }

    @Test
    void mergeShouldStayUnchangedWhenNoStepChanged() {
        RewriteResult merged = RewriteResult.merge(zero, RewriteResult.unchanged(x), RewriteResult.unchanged(zero));

        assertFalse(merged.changed());
        assertSame(zero, merged.node());
        assertFalse(RewriteResult.merge(x).changed());
    }

    @Test
    void shouldRequireNode() {
        assertThrows(NullPointerException.class, () -> RewriteResult.changed(null));
        assertThrows(NullPointerException.class, () -> RewriteResult.merge(null, RewriteResult.changed(x)));
    }
}
