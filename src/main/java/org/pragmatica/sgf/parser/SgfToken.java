package org.pragmatica.sgf.parser;

import org.pragmatica.sgf.tree.SourceSpan;

/**
 * Token types for the SGF lexer.
 */
public sealed interface SgfToken {
    SourceSpan span();

    TokenKind kind();

    String text();

    // Delimiters
    record LeftParen(SourceSpan span) implements SgfToken {
        @Override
        public TokenKind kind() {
            return TokenKind.LEFT_PAREN;
        }

        @Override
        public String text() {
            return "(";
        }
    }

    record RightParen(SourceSpan span) implements SgfToken {
        @Override
        public TokenKind kind() {
            return TokenKind.RIGHT_PAREN;
        }

        @Override
        public String text() {
            return ")";
        }
    }

    record Semicolon(SourceSpan span) implements SgfToken {
        @Override
        public TokenKind kind() {
            return TokenKind.SEMICOLON;
        }

        @Override
        public String text() {
            return ";";
        }
    }

    // Property parts
    record Tag(SourceSpan span, String name) implements SgfToken {
        @Override
        public TokenKind kind() {
            return TokenKind.TAG;
        }

        @Override
        public String text() {
            return name;
        }
    }

    /**
     * Bracketed value; {@code text} is the content between the brackets with escapes kept.
     */
    record Value(SourceSpan span, String text) implements SgfToken {
        @Override
        public TokenKind kind() {
            return TokenKind.VALUE;
        }
    }

    record Eof(SourceSpan span) implements SgfToken {
        @Override
        public TokenKind kind() {
            return TokenKind.EOF;
        }

        @Override
        public String text() {
            return "";
        }
    }
}
