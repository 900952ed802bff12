package org.pragmatica.sgf.parser;

/**
 * Receives lexer progress after every token.
 */
@FunctionalInterface
public interface ProgressListener {
    ProgressListener NONE = (position, length) -> {};

    /**
     * @param position characters consumed so far
     * @param length   total input length, or 0 when unknown
     */
    void onProgress(long position, long length);
}
