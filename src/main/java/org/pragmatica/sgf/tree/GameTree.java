package org.pragmatica.sgf.tree;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * A game tree: the sole owner of its nodes.
 *
 * <p>Trees are not copyable. Ownership moves with {@link #transfer()}, which leaves the source
 * empty; {@link #reset()} releases every node.
 */
public final class GameTree {
    private NodeArena arena;
    private SgfNode root;

    public GameTree() {
        this(new NodeArena());
    }

    public GameTree(NodeArena arena) {
        this.arena = Objects.requireNonNull(arena, "arena");
        this.root = null;
    }

    private GameTree(NodeArena arena, SgfNode root) {
        this.arena = arena;
        this.root = root;
    }

    public Optional<SgfNode> root() {
        return Optional.ofNullable(root);
    }

    public void setRoot(SgfNode node) {
        Objects.requireNonNull(node, "node");
        if (!arena.contains(node)) {
            throw new IllegalArgumentException("Root node " + node.handle() + " is not owned by this tree");
        }
        this.root = node;
    }

    public NodeArena arena() {
        return arena;
    }

    /**
     * Number of live nodes owned by the tree.
     */
    public int size() {
        return arena.size();
    }

    public boolean isEmpty() {
        return root == null;
    }

    /**
     * Move every node into a new tree, leaving this one empty.
     */
    public GameTree transfer() {
        var moved = new GameTree(arena, root);
        this.arena = new NodeArena();
        this.root = null;
        return moved;
    }

    /**
     * Release every node and forget the root.
     */
    public void reset() {
        arena.releaseAll();
        root = null;
    }

    /**
     * Nodes reachable from the root, parents before children, siblings in document order.
     */
    public List<SgfNode> preOrder() {
        return root == null ? List.of() : preOrder(root);
    }

    /**
     * Nodes of the subtree rooted at {@code start}, parents before children.
     */
    public static List<SgfNode> preOrder(SgfNode start) {
        var result = new ArrayList<SgfNode>();
        var pending = new ArrayDeque<SgfNode>();
        pending.push(start);
        while (!pending.isEmpty()) {
            var node = pending.pop();
            result.add(node);
            var children = node.children();
            for (int i = children.size() - 1; i >= 0; i--) {
                pending.push(children.get(i));
            }
        }
        return result;
    }
}
