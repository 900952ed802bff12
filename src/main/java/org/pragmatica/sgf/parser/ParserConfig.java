package org.pragmatica.sgf.parser;

import org.pragmatica.sgf.error.Diagnostic;

import java.util.Objects;

/**
 * Loader configuration options.
 *
 * @param annotate         run the proof-size annotation pass after parsing
 * @param progressListener receives lexer progress
 * @param contextWidth     characters of source shown on each side of an error span in log output
 */
public record ParserConfig(
    boolean annotate,
    ProgressListener progressListener,
    int contextWidth
) {
    public static final ParserConfig DEFAULT = new ParserConfig(
        true,
        ProgressListener.NONE,
        Diagnostic.DEFAULT_CONTEXT_WIDTH
    );

    public ParserConfig {
        Objects.requireNonNull(progressListener, "progressListener");
        if (contextWidth < 0) {
            throw new IllegalArgumentException("contextWidth must not be negative: " + contextWidth);
        }
    }
}
