package org.pragmatica.sgf.proof;

import org.junit.jupiter.api.Test;
import org.pragmatica.sgf.error.GrammarError;
import org.pragmatica.sgf.error.InconsistentTreeException;
import org.pragmatica.sgf.tree.NodeArena;
import org.pragmatica.sgf.tree.NodeType;
import org.pragmatica.sgf.tree.Property;
import org.pragmatica.sgf.tree.SgfNode;
import org.pragmatica.sgf.tree.SourceLocation;
import org.pragmatica.sgf.tree.SourceSpan;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class PropertyInterpreterTest {

    private static final SourceSpan SPAN = SourceSpan.of(SourceLocation.START, SourceLocation.at(1, 5, 4));

    private static SgfNode node(Property... properties) {
        var node = new NodeArena().allocate();
        for (var property : properties) {
            node.addProperty(property);
        }
        return node;
    }

    private static Property property(String tag, String... values) {
        return new Property(tag, List.of(values), SPAN);
    }

    @Test
    void blackMove_marksAndNode() {
        var node = node(property("B", "aa"));

        PropertyInterpreter.interpret(node);

        assertEquals(NodeType.AND, node.type());
    }

    @Test
    void whiteMove_marksOrNode() {
        var node = node(property("W", "aa"));

        PropertyInterpreter.interpret(node);

        assertEquals(NodeType.OR, node.type());
    }

    @Test
    void noMoveMarker_leavesTypeNone() {
        var node = node(property("AB", "aa", "bb"), property("GM", "1"));

        PropertyInterpreter.interpret(node);

        assertEquals(NodeType.NONE, node.type());
        assertFalse(node.solved());
    }

    @Test
    void moveMarkerWithTwoValues_fails() {
        var node = node(property("B", "aa", "bb"));

        var error = assertThrows(GrammarError.class, () -> PropertyInterpreter.interpret(node));

        assertEquals("Property B takes exactly one value, found 2", error.reason());
        assertEquals(SPAN, error.span());
    }

    @Test
    void solverStatusWinOrLoss_marksSolved() {
        var win = node(property("C", "solver_status: WIN"));
        var loss = node(property("C", "solver_status: LOSS"));
        var unknown = node(property("C", "solver_status: UNKNOWN"));

        PropertyInterpreter.interpret(win);
        PropertyInterpreter.interpret(loss);
        PropertyInterpreter.interpret(unknown);

        assertTrue(win.solved());
        assertTrue(loss.solved());
        assertFalse(unknown.solved());
    }

    @Test
    void transpositionMatch_onSolvedNode_setsFlag() {
        var node = node(property("C", "solver_status: WIN\nmatch_tt = true"));

        PropertyInterpreter.interpret(node);

        assertTrue(node.matchedTransposition());
        assertFalse(node.prunedBySearchWindow());
    }

    @Test
    void equalLoss_otherThanMinusOne_setsSearchWindowFlag() {
        var pruned = node(property("C", "solver_status: LOSS\nequal_loss = 17"));
        var unpruned = node(property("C", "solver_status: LOSS\nequal_loss = -1"));

        PropertyInterpreter.interpret(pruned);
        PropertyInterpreter.interpret(unpruned);

        assertTrue(pruned.prunedBySearchWindow());
        assertFalse(unpruned.prunedBySearchWindow());
    }

    @Test
    void transpositionMatch_onUnsolvedNode_fails() {
        var node = node(property("C", "match_tt = true"));

        assertThrows(InconsistentTreeException.class, () -> PropertyInterpreter.interpret(node));
    }

    @Test
    void searchWindowCutoff_onUnsolvedNode_fails() {
        var node = node(property("C", "equal_loss = 2"));

        assertThrows(InconsistentTreeException.class, () -> PropertyInterpreter.interpret(node));
    }

    @Test
    void lastMoveMarker_wins() {
        var node = node(property("B", "aa"), property("W", "bb"));

        PropertyInterpreter.interpret(node);

        assertEquals(NodeType.OR, node.type());
    }
}
