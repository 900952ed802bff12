package org.pragmatica.sgf.parser;

import org.junit.jupiter.api.Test;
import org.pragmatica.sgf.error.GrammarError;
import org.pragmatica.sgf.error.LexicalError;
import org.pragmatica.sgf.tree.NodeAllocator;
import org.pragmatica.sgf.tree.NodeArena;
import org.pragmatica.sgf.tree.Property;
import org.pragmatica.sgf.tree.SgfNode;

import java.util.ArrayList;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.junit.jupiter.api.Assertions.*;

class SgfParserTest {

    private static SgfParser parser(String input, NodeAllocator allocator) {
        return new SgfParser(new StringCharSource(input), allocator);
    }

    private static List<SgfNode> drain(SgfParser parser) {
        var nodes = new ArrayList<SgfNode>();
        var node = parser.nextNode();
        while (node.isPresent()) {
            nodes.add(node.get());
            node = parser.nextNode();
        }
        return nodes;
    }

    private static String firstValue(SgfNode node, String tag) {
        return node.properties()
                   .stream()
                   .filter(p -> p.tag().equals(tag))
                   .map(Property::firstValue)
                   .findFirst()
                   .orElse(null);
    }

    @Test
    void nextNode_emitsNodesInDocumentOrder() {
        var parser = parser("(;B[a](;W[b];B[c])(;W[d]))", new NodeArena());

        var root = parser.nextNode().orElseThrow();
        var wb = parser.nextNode().orElseThrow();
        var bc = parser.nextNode().orElseThrow();
        var wd = parser.nextNode().orElseThrow();

        assertThat(parser.nextNode()).isEmpty();
        assertEquals("a", firstValue(root, "B"));
        assertEquals("b", firstValue(wb, "W"));
        assertEquals("c", firstValue(bc, "B"));
        assertEquals("d", firstValue(wd, "W"));
        assertThat(List.of(root.id(), wb.id(), bc.id(), wd.id())).containsExactly(0L, 1L, 2L, 3L);
    }

    @Test
    void nextNode_buildsChildSiblingStructure() {
        var parser = parser("(;B[a](;W[b];B[c])(;W[d]))", new NodeArena());
        drain(parser);

        var root = parser.root().orElseThrow();
        assertThat(root.parent()).isEmpty();
        assertThat(root.children()).extracting(n -> firstValue(n, "W"))
                                   .containsExactly("b", "d");
        var wb = root.children().get(0);
        assertThat(wb.children()).extracting(n -> firstValue(n, "B"))
                                 .containsExactly("c");
    }

    @Test
    void nextNode_afterEnd_keepsReturningEmpty() {
        var parser = parser("(;B[a])", new NodeArena());
        drain(parser);

        assertTrue(parser.isFinished());
        assertThat(parser.nextNode()).isEmpty();
        assertThat(parser.root()).isPresent();
    }

    @Test
    void root_beforeEnd_isAbsent() {
        var parser = parser("(;B[a];W[b])", new NodeArena());
        parser.nextNode();

        assertThat(parser.root()).isEmpty();
    }

    @Test
    void properties_keepOrderAndAllValues() {
        var parser = parser("(;AB[aa][bb]C[note]W[cc])", new NodeArena());
        var node = parser.nextNode().orElseThrow();

        assertThat(node.properties()).extracting(Property::tag)
                                     .containsExactly("AB", "C", "W");
        assertThat(node.properties().get(0).values()).containsExactly("aa", "bb");
        assertEquals(2, node.properties().get(0).span().startOffset());
        assertEquals(12, node.properties().get(0).span().endOffset());
    }

    @Test
    void dummyRoot_isReleasedAfterParse() {
        var arena = new NodeArena();
        var parser = parser("(;B[a](;W[b])(;W[c]))", arena);

        drain(parser);

        assertEquals(3, arena.size());
        assertThat(arena.nodes()).contains(parser.root().orElseThrow());
    }

    @Test
    void customAllocator_receivesEveryAllocation() {
        var recording = new RecordingAllocator();
        var parser = parser("(;B[a](;W[b]))", recording);

        drain(parser);

        // dummy root plus two real nodes
        assertEquals(3, recording.allocated.size());
        assertEquals(1, recording.released.size());
        assertTrue(recording.released.get(0).isReleased());
        assertNotSame(parser.root().orElseThrow(), recording.released.get(0));
        assertEquals(2, recording.arena.size());
    }

    @Test
    void extraRightParen_failsAtThatParen() {
        var parser = parser("(;B[a]))", new NodeArena());

        assertThat(parser.nextNode()).isPresent();
        var error = assertThrows(GrammarError.class, parser::nextNode);

        assertEquals("Unmatched right parenthesis", error.reason());
        assertEquals(7, error.span().startOffset());
        assertEquals(8, error.span().endOffset());
    }

    @Test
    void unmatchedLeftParen_reportsInnermostOpenParen() {
        var parser = parser("(;B[a](;W[b]", new NodeArena());

        var error = assertThrows(GrammarError.class, () -> drain(parser));

        assertEquals("Unmatched left parenthesis", error.reason());
        assertEquals(6, error.span().startOffset());
        assertEquals(7, error.span().endOffset());
    }

    @Test
    void unmatchedLeftParen_afterClosedBranch_reportsOuterParen() {
        var parser = parser("(;B[a](;W[b])", new NodeArena());

        var error = assertThrows(GrammarError.class, () -> drain(parser));

        assertEquals(0, error.span().startOffset());
    }

    @Test
    void tagWithoutSemicolon_fails() {
        var error = assertThrows(GrammarError.class, () -> drain(parser("(B[a])", new NodeArena())));

        assertEquals("Unexpected tag B", error.reason());
        assertEquals(1, error.span().startOffset());
        assertThat(error.diagnostic().labels()).extracting(l -> l.message())
                                               .containsExactly("expected ';'");
    }

    @Test
    void tagWithoutValue_fails() {
        var error = assertThrows(GrammarError.class, () -> drain(parser("(;B)", new NodeArena())));

        assertEquals("Unexpected ')'", error.reason());
        assertEquals(3, error.span().startOffset());
    }

    @Test
    void emptyNode_fails() {
        var error = assertThrows(GrammarError.class, () -> drain(parser("(;B[a];)", new NodeArena())));

        assertEquals("Unexpected ')'", error.reason());
    }

    @Test
    void missingOpeningParen_fails() {
        var error = assertThrows(GrammarError.class, () -> drain(parser(";B[a]", new NodeArena())));

        assertEquals("Unexpected ';'", error.reason());
        assertEquals(0, error.span().startOffset());
    }

    @Test
    void emptyBranch_fails() {
        var error = assertThrows(GrammarError.class, () -> drain(parser("()", new NodeArena())));

        assertEquals("Unexpected ')'", error.reason());
    }

    @Test
    void secondGameTree_fails() {
        var error = assertThrows(GrammarError.class, () -> drain(parser("(;B[a])(;W[b])", new NodeArena())));

        assertEquals("Multiple game trees", error.reason());
        assertEquals(8, error.span().startOffset());
    }

    @Test
    void lexicalErrors_propagate() {
        assertThrows(LexicalError.class, () -> drain(parser("(;C[hello", new NodeArena())));
    }

    @Test
    void emptyInput_finishesWithoutRoot() {
        var parser = parser("  ", new NodeArena());

        assertThat(parser.nextNode()).isEmpty();
        assertThat(parser.root()).isEmpty();
    }

    private static final class RecordingAllocator implements NodeAllocator {
        private final NodeArena arena = new NodeArena();
        private final List<SgfNode> allocated = new ArrayList<>();
        private final List<SgfNode> released = new ArrayList<>();

        @Override
        public SgfNode allocate() {
            var node = arena.allocate();
            allocated.add(node);
            return node;
        }

        @Override
        public boolean deallocate(SgfNode node) {
            released.add(node);
            return arena.deallocate(node);
        }
    }
}
