package org.pragmatica.sgf.parser;

import org.pragmatica.sgf.error.LexicalError;
import org.pragmatica.sgf.tree.SourceLocation;
import org.pragmatica.sgf.tree.SourceSpan;

import java.util.Objects;

/**
 * Lexer for SGF text. Produces one token per {@link #nextToken()} call.
 */
public final class SgfLexer {
    private static final int DEFAULT_TOKEN_CAPACITY = 32;

    private final CharSource source;
    private final long length;
    private final ProgressListener progressListener;
    private int line;
    private int column;

    public SgfLexer(CharSource source) {
        this(source, 0, ProgressListener.NONE);
    }

    /**
     * @param length           total input length reported to the listener, 0 when unknown
     * @param progressListener notified after every token except end of input
     */
    public SgfLexer(CharSource source, long length, ProgressListener progressListener) {
        this.source = Objects.requireNonNull(source, "source");
        this.length = length;
        this.progressListener = Objects.requireNonNull(progressListener, "progressListener");
        this.line = 1;
        this.column = 1;
    }

    /**
     * Scan the next token. Keeps returning {@link SgfToken.Eof} once the input is exhausted.
     *
     * @throws LexicalError on an invalid character or an unterminated value
     */
    public SgfToken nextToken() {
        var token = scan();
        if (!(token instanceof SgfToken.Eof)) {
            progressListener.onProgress(source.position(), length);
        }
        return token;
    }

    private SgfToken scan() {
        while (true) {
            var start = currentLocation();
            int c = advance();
            if (c == CharSource.EOF) {
                return new SgfToken.Eof(SourceSpan.at(start));
            }
            if (c == '(') {
                return new SgfToken.LeftParen(span(start));
            }
            if (c == ')') {
                return new SgfToken.RightParen(span(start));
            }
            if (c == ';') {
                return new SgfToken.Semicolon(span(start));
            }
            if (c == '[') {
                return scanValue(start);
            }
            if (isTagChar(c)) {
                return scanTag(start, (char) c);
            }
            if (Character.isWhitespace(c)) {
                continue;
            }
            throw new LexicalError("Invalid character '" + (char) c + "'", span(start), "not allowed outside a value");
        }
    }

    private SgfToken scanValue(SourceLocation start) {
        var sb = new StringBuilder(DEFAULT_TOKEN_CAPACITY);
        boolean escape = false;
        while (true) {
            int c = advance();
            if (c == CharSource.EOF) {
                throw new LexicalError("Unexpected end of input in value",
                                       SourceSpan.at(currentLocation()),
                                       "value opened at " + start + " is never closed");
            }
            if (c == ']' && !escape) {
                break;
            }
            // the backslash stays in the value together with the escaped character
            if (c == '\\' && !escape) {
                sb.append('\\');
                escape = true;
                continue;
            }
            sb.append((char) c);
            escape = false;
        }
        return new SgfToken.Value(span(start), sb.toString());
    }

    private SgfToken scanTag(SourceLocation start, char first) {
        var sb = new StringBuilder(DEFAULT_TOKEN_CAPACITY);
        sb.append(first);
        while (isTagChar(source.peek())) {
            sb.append((char) advance());
        }
        return new SgfToken.Tag(span(start), sb.toString());
    }

    private int advance() {
        int c = source.next();
        if (c == '\n') {
            line++;
            column = 1;
        } else if (c != CharSource.EOF) {
            column++;
        }
        return c;
    }

    private SourceLocation currentLocation() {
        return SourceLocation.at(line, column, source.position());
    }

    private SourceSpan span(SourceLocation start) {
        return SourceSpan.of(start, currentLocation());
    }

    private static boolean isTagChar(int c) {
        return (c >= 'a' && c <= 'z') || (c >= 'A' && c <= 'Z') || (c >= '0' && c <= '9') || c == '_';
    }
}
