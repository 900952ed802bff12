package org.pragmatica.sgf.parser;

/**
 * Character stream feeding the lexer.
 */
public interface CharSource {
    /**
     * Returned by {@link #peek()} and {@link #next()} once the stream is exhausted.
     */
    int EOF = -1;

    /**
     * Next character without consuming it, or {@link #EOF}.
     */
    int peek();

    /**
     * Consume and return the next character, or {@link #EOF}.
     */
    int next();

    /**
     * Push the last character returned by {@link #next()} back onto the stream.
     *
     * @throws IllegalStateException if there is nothing to put back
     */
    void putBack();

    /**
     * Number of characters consumed so far.
     */
    int position();
}
