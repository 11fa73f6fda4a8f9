package io.github.cyfko.binexp.core.parsing;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.NoSuchElementException;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("TokenCursor Tests")
class TokenCursorTest {

    @Test
    void shouldAdvanceThroughTokens() {
        // Given
        TokenCursor cursor = new TokenCursor(List.of("+", "1", "2"));

        // Then
        assertEquals("+", cursor.peek());
        assertEquals("+", cursor.next());
        assertEquals(1, cursor.position());
        assertEquals(2, cursor.remaining());
        assertEquals("1", cursor.next());
        assertEquals("2", cursor.next());
        assertFalse(cursor.hasNext());
        assertNull(cursor.peek());
        assertEquals(0, cursor.remaining());
    }

    @Test
    void shouldFailWhenExhausted() {
        TokenCursor cursor = new TokenCursor(List.of());

        assertFalse(cursor.hasNext());
        assertThrows(NoSuchElementException.class, cursor::next);
    }

    @Test
    void shouldRejectNullList() {
        assertThrows(NullPointerException.class, () -> new TokenCursor(null));
    }
}
