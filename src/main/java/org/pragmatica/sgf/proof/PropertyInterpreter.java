package org.pragmatica.sgf.proof;

import org.pragmatica.sgf.error.GrammarError;
import org.pragmatica.sgf.error.InconsistentTreeException;
import org.pragmatica.sgf.tree.NodeType;
import org.pragmatica.sgf.tree.Property;
import org.pragmatica.sgf.tree.SgfNode;

/**
 * Derives node type and solver flags from the {@code B}, {@code W} and {@code C} properties.
 * Other properties are left untouched.
 */
public final class PropertyInterpreter {
    public static final String BLACK_MOVE = "B";
    public static final String WHITE_MOVE = "W";
    public static final String COMMENT = "C";

    private PropertyInterpreter() {}

    /**
     * Apply every recognized property of a completed node, in document order.
     *
     * @throws GrammarError               when a recognized property does not carry exactly one value
     * @throws InconsistentTreeException when a provenance flag is set on an unsolved node
     */
    public static void interpret(SgfNode node) {
        for (var property : node.properties()) {
            switch (property.tag()) {
                case BLACK_MOVE -> {
                    requireSingleValue(property);
                    node.setType(NodeType.AND);
                }
                case WHITE_MOVE -> {
                    requireSingleValue(property);
                    node.setType(NodeType.OR);
                }
                case COMMENT -> {
                    requireSingleValue(property);
                    applyComment(node, property.firstValue());
                }
                default -> {}
            }
        }
    }

    private static void applyComment(SgfNode node, String comment) {
        CommentFields.find(comment, CommentFields.SOLVER_STATUS)
                     .filter(status -> status.equals("WIN") || status.equals("LOSS"))
                     .ifPresent(status -> node.setSolved(true));

        node.setMatchedTransposition(CommentFields.find(comment, CommentFields.MATCH_TT)
                                                  .map("true"::equals)
                                                  .orElse(false));
        if (node.matchedTransposition() && !node.solved()) {
            throw new InconsistentTreeException(node.id(), "transposition match on an unsolved node");
        }

        node.setPrunedBySearchWindow(CommentFields.find(comment, CommentFields.EQUAL_LOSS)
                                                  .map(value -> !value.equals("-1"))
                                                  .orElse(false));
        if (node.prunedBySearchWindow() && !node.solved()) {
            throw new InconsistentTreeException(node.id(), "search-window cutoff on an unsolved node");
        }
    }

    private static void requireSingleValue(Property property) {
        if (property.values().size() != 1) {
            throw new GrammarError("Property " + property.tag() + " takes exactly one value, found "
                                   + property.values().size(),
                                   property.span(),
                                   "expected a single [value]");
        }
    }
}
