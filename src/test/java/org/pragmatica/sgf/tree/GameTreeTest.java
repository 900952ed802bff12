package org.pragmatica.sgf.tree;

import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.junit.jupiter.api.Assertions.*;

class GameTreeTest {

    private static GameTree sampleTree() {
        var tree = new GameTree();
        var arena = tree.arena();
        var root = arena.allocate();
        var left = arena.allocate();
        var leftLeaf = arena.allocate();
        var right = arena.allocate();
        root.addChild(left);
        left.addChild(leftLeaf);
        root.addChild(right);
        tree.setRoot(root);
        return tree;
    }

    @Test
    void newTree_isEmpty() {
        var tree = new GameTree();

        assertTrue(tree.isEmpty());
        assertThat(tree.root()).isEmpty();
        assertThat(tree.preOrder()).isEmpty();
        assertEquals(0, tree.size());
    }

    @Test
    void preOrder_visitsParentsBeforeChildrenInDocumentOrder() {
        var tree = sampleTree();

        assertThat(tree.preOrder()).extracting(SgfNode::handle)
                                   .containsExactly(0, 1, 2, 3);
    }

    @Test
    void transfer_movesOwnershipAndEmptiesSource() {
        var source = sampleTree();
        var root = source.root().orElseThrow();

        var moved = source.transfer();

        assertThat(moved.root()).contains(root);
        assertEquals(4, moved.size());
        assertTrue(source.isEmpty());
        assertEquals(0, source.size());
        assertNotSame(source.arena(), moved.arena());
        assertFalse(root.isReleased());
    }

    @Test
    void reset_releasesEveryNode() {
        var tree = sampleTree();
        var nodes = tree.preOrder();

        tree.reset();

        assertTrue(tree.isEmpty());
        assertEquals(0, tree.size());
        assertThat(nodes).allMatch(SgfNode::isReleased);
    }

    @Test
    void setRoot_foreignNode_fails() {
        var tree = new GameTree();
        var foreign = new NodeArena().allocate();

        assertThrows(IllegalArgumentException.class, () -> tree.setRoot(foreign));
    }
}
