package org.pragmatica.sgf.parser;

import java.util.Objects;

/**
 * {@link CharSource} over an in-memory string.
 */
public final class StringCharSource implements CharSource {
    private final String text;
    private int index;

    public StringCharSource(String text) {
        this.text = Objects.requireNonNull(text, "text");
        this.index = 0;
    }

    @Override
    public int peek() {
        return index < text.length() ? text.charAt(index) : EOF;
    }

    @Override
    public int next() {
        return index < text.length() ? text.charAt(index++) : EOF;
    }

    @Override
    public void putBack() {
        if (index == 0) {
            throw new IllegalStateException("Nothing to put back");
        }
        index--;
    }

    @Override
    public int position() {
        return index;
    }

    public int length() {
        return text.length();
    }
}
