package org.pragmatica.sgf.proof;

import java.util.Optional;

/**
 * Extraction of {@code key value} fields written by the solver into SGF comments.
 */
public final class CommentFields {
    public static final String SOLVER_STATUS = "solver_status: ";
    public static final String MATCH_TT = "match_tt = ";
    public static final String EQUAL_LOSS = "equal_loss = ";

    private CommentFields() {}

    /**
     * Value following the first occurrence of {@code key}, up to the end of that line.
     * A trailing carriage return is dropped.
     */
    public static Optional<String> find(String comment, String key) {
        int pos = comment.indexOf(key);
        if (pos < 0) {
            return Optional.empty();
        }
        pos += key.length();
        int end = comment.indexOf('\n', pos);
        if (end < 0) {
            end = comment.length();
        } else if (end > pos && comment.charAt(end - 1) == '\r') {
            end--;
        }
        return Optional.of(comment.substring(pos, end));
    }
}
