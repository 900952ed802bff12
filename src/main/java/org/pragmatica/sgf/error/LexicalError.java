package org.pragmatica.sgf.error;

import org.pragmatica.sgf.tree.SourceSpan;

/**
 * Malformed character stream: an invalid character or an unterminated value.
 */
public final class LexicalError extends SgfException {

    public LexicalError(String reason, SourceSpan span) {
        this(reason, span, "");
    }

    public LexicalError(String reason, SourceSpan span, String label) {
        super(reason, span, label);
    }
}
