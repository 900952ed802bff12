package org.pragmatica.sgf.tree;

/**
 * A position in SGF text: line and column (both 1-based) plus the character offset.
 * The offset counts UTF-16 chars of the decoded text, so it differs from a byte position
 * once non-ASCII text precedes it.
 */
public record SourceLocation(int line, int column, int offset) {

    public static final SourceLocation START = new SourceLocation(1, 1, 0);

    public static SourceLocation at(int line, int column, int offset) {
        return new SourceLocation(line, column, offset);
    }

    @Override
    public String toString() {
        return line + ":" + column;
    }
}
