package org.pragmatica.sgf.tree;

import java.util.List;
import java.util.Objects;

/**
 * One SGF property: a tag with its ordered values, exactly as read from the source.
 *
 * @param tag    property identifier, e.g. {@code B} or {@code C}
 * @param values raw bracket contents, escapes retained
 * @param span   source range from the tag to the closing bracket of the last value
 */
public record Property(String tag, List<String> values, SourceSpan span) {
    public Property {
        Objects.requireNonNull(tag, "tag");
        Objects.requireNonNull(span, "span");
        values = List.copyOf(values);
    }

    public String firstValue() {
        return values.isEmpty() ? "" : values.get(0);
    }
}
