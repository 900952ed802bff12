package org.pragmatica.sgf.error;

import org.pragmatica.sgf.tree.SourceSpan;

/**
 * Well-formed tokens in an order the SGF grammar forbids, including unmatched parentheses.
 */
public final class GrammarError extends SgfException {

    public GrammarError(String reason, SourceSpan span) {
        this(reason, span, "");
    }

    public GrammarError(String reason, SourceSpan span, String label) {
        super(reason, span, label);
    }
}
