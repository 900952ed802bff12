package org.pragmatica.sgf.error;

import org.pragmatica.sgf.tree.SourceSpan;

import java.util.Objects;

/**
 * Failure to read SGF text, located by a source span.
 *
 * <p>The message ends with {@code at start:end}, where both offsets are UTF-16 char indices
 * into the decoded text.
 */
public abstract sealed class SgfException extends RuntimeException permits LexicalError, GrammarError {
    private final String reason;
    private final SourceSpan span;
    private final String label;

    protected SgfException(String reason, SourceSpan span, String label) {
        super(reason + " at " + span.startOffset() + ":" + span.endOffset());
        this.reason = Objects.requireNonNull(reason, "reason");
        this.span = span;
        this.label = label == null ? "" : label;
    }

    /**
     * Error message without location.
     */
    public String reason() {
        return reason;
    }

    public SourceSpan span() {
        return span;
    }

    /**
     * Diagnostic suitable for rendering against the source text.
     */
    public Diagnostic diagnostic() {
        var diagnostic = Diagnostic.error(reason, span)
                                   .withNote("offsets " + span.startOffset() + ":" + span.endOffset());
        return label.isEmpty() ? diagnostic : diagnostic.withLabel(label);
    }
}
