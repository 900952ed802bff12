package org.pragmatica.sgf.error;

import org.pragmatica.sgf.tree.SourceSpan;

import java.util.ArrayList;
import java.util.List;

/**
 * Renderable description of an SGF error.
 *
 * <p>Two renderings are available. {@link #format(String, String)} gives a gutter view:
 * <pre>
 * error: Unmatched right parenthesis
 *   --> game.sgf:1:8
 *   |
 * 1 | (;B[a]))
 *   |        ^ no open '(' left
 *   |
 * </pre>
 * {@link #highlight(String, int, String, String)} gives a one-line excerpt with the span
 * wrapped in terminal color codes.
 *
 * @param message Primary error message
 * @param span    Source span where the error occurred
 * @param labels  Labeled spans shown under the source line
 * @param notes   Additional notes or suggestions
 */
public record Diagnostic(
    String message,
    SourceSpan span,
    List<Label> labels,
    List<String> notes
) {
    public static final String ANSI_RED = "\033[1;31m";
    public static final String ANSI_RESET = "\033[0m";
    public static final int DEFAULT_CONTEXT_WIDTH = 20;

    /**
     * A labeled span providing additional context.
     *
     * @param span    Source span for this label
     * @param message Label message, printed after the underline
     */
    public record Label(SourceSpan span, String message) {}

    public static Diagnostic error(String message, SourceSpan span) {
        return new Diagnostic(message, span, List.of(), List.of());
    }

    /**
     * Add a label under the primary span.
     */
    public Diagnostic withLabel(String message) {
        var newLabels = new ArrayList<>(labels);
        newLabels.add(new Label(span, message));
        return new Diagnostic(this.message, span, List.copyOf(newLabels), notes);
    }

    public Diagnostic withNote(String note) {
        var newNotes = new ArrayList<>(notes);
        newNotes.add(note);
        return new Diagnostic(message, span, labels, List.copyOf(newNotes));
    }

    /**
     * Format with a line-numbered gutter and underlined spans.
     *
     * @param source   The SGF text the span refers to
     * @param filename Optional filename for display
     */
    public String format(String source, String filename) {
        var sb = new StringBuilder();
        var lines = source.split("\n", -1);

        sb.append("error: ").append(message).append("\n");

        var loc = span.start();
        sb.append("  --> ");
        if (filename != null) {
            sb.append(filename).append(":");
        }
        sb.append(loc.line()).append(":").append(loc.column()).append("\n");

        int minLine = span.start().line();
        int maxLine = span.end().line();
        for (var label : labels) {
            minLine = Math.min(minLine, label.span().start().line());
            maxLine = Math.max(maxLine, label.span().end().line());
        }

        int gutterWidth = String.valueOf(maxLine).length();

        sb.append(" ".repeat(gutterWidth + 1)).append("|\n");

        for (int lineNum = minLine; lineNum <= maxLine; lineNum++) {
            if (lineNum < 1 || lineNum > lines.length) continue;

            String lineContent = lines[lineNum - 1];
            String lineNumStr = String.format("%" + gutterWidth + "d", lineNum);

            sb.append(lineNumStr).append(" | ").append(lineContent).append("\n");

            var lineLabels = labelsOnLine(lineNum);
            if (!lineLabels.isEmpty()) {
                sb.append(" ".repeat(gutterWidth)).append(" | ");
                sb.append(formatUnderlines(lineNum, lineContent, lineLabels));
                sb.append("\n");
            }
        }

        sb.append(" ".repeat(gutterWidth + 1)).append("|\n");

        for (var note : notes) {
            sb.append(" ".repeat(gutterWidth + 1)).append("= ").append(note).append("\n");
        }

        return sb.toString();
    }

    /**
     * Message plus an excerpt of {@code contextWidth} characters around the span, the span
     * itself wrapped in {@code open} and {@code close}.
     */
    public String highlight(String source, int contextWidth, String open, String close) {
        int start = Math.min(span.startOffset(), source.length());
        int end = Math.min(Math.max(span.endOffset(), start), source.length());
        int from = Math.max(0, start - contextWidth);
        int to = Math.min(source.length(), end + contextWidth);
        return message + " at " + span.startOffset() + ":" + span.endOffset() + "\n"
               + source.substring(from, start)
               + open + source.substring(start, end) + close
               + source.substring(end, to);
    }

    public String highlight(String source) {
        return highlight(source, DEFAULT_CONTEXT_WIDTH, ANSI_RED, ANSI_RESET);
    }

    private List<Label> labelsOnLine(int lineNum) {
        var result = new ArrayList<Label>();

        if (span.start().line() <= lineNum && span.end().line() >= lineNum && labels.isEmpty()) {
            result.add(new Label(span, ""));
        }

        for (var label : labels) {
            if (label.span().start().line() <= lineNum && label.span().end().line() >= lineNum) {
                result.add(label);
            }
        }

        return result;
    }

    private String formatUnderlines(int lineNum, String lineContent, List<Label> lineLabels) {
        var sb = new StringBuilder();
        int currentCol = 1;

        var sorted = lineLabels.stream()
            .sorted((a, b) -> Integer.compare(a.span().start().column(), b.span().start().column()))
            .toList();

        for (var label : sorted) {
            int startCol = label.span().start().line() == lineNum ? label.span().start().column() : 1;
            int endCol = label.span().end().line() == lineNum
                ? label.span().end().column()
                : lineContent.length() + 1;

            while (currentCol < startCol) {
                sb.append(" ");
                currentCol++;
            }

            int underlineLen = Math.max(1, endCol - startCol);
            sb.append("^".repeat(underlineLen));
            currentCol += underlineLen;

            if (!label.message().isEmpty()) {
                sb.append(" ").append(label.message());
            }
        }

        return sb.toString();
    }
}
