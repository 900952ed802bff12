package org.pragmatica.sgf.parser;

/**
 * Kinds of SGF tokens.
 */
public enum TokenKind {
    LEFT_PAREN("'('"),
    RIGHT_PAREN("')'"),
    SEMICOLON("';'"),
    TAG("tag"),
    VALUE("value"),
    EOF("end of input");

    private final String display;

    TokenKind(String display) {
        this.display = display;
    }

    public String display() {
        return display;
    }
}
