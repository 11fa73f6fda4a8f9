package io.github.cyfko.binexp.core.parsing;

import java.util.List;
import java.util.NoSuchElementException;
import java.util.Objects;

/**
 * Forward-only read position over an immutable token list.
 * <p>
 * Replaces destructive removal from the front of the caller's list: the list is left untouched
 * and the parser advances an index instead.
 * </p>
 *
 * @author Frank KOSSI
 * @since 1.0.0
 */
public final class TokenCursor {

    private final List<String> tokens;
    private int position;

    public TokenCursor(List<String> tokens) {
        this.tokens = Objects.requireNonNull(tokens, "Tokens cannot be null");
    }

    public boolean hasNext() {
        return position < tokens.size();
    }

    /**
     * @return the current token, the cursor is then advanced
     * @throws NoSuchElementException if every token has been consumed
     */
    public String next() {
        if (!hasNext()) {
            throw new NoSuchElementException("No token left at position " + position);
        }
        return tokens.get(position++);
    }

    /**
     * @return the current token without consuming it, or null if none is left
     */
    public String peek() {
        return hasNext() ? tokens.get(position) : null;
    }

    /**
     * @return index of the next token to be read
     */
    public int position() {
        return position;
    }

    /**
     * @return number of tokens not yet consumed
     */
    public int remaining() {
        return tokens.size() - position;
    }
}
