package org.pragmatica.sgf.tree;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * One {@code ;}-introduced SGF node.
 *
 * <p>Tree links are arena handles: {@code firstChild} heads a singly linked list continued
 * through {@code nextSibling}, and {@code parent} points back to the node whose list contains
 * this one. Nodes are created only by a {@link NodeArena}.
 */
public final class SgfNode {
    private final NodeArena arena;
    private final int handle;

    private int parent = NodeArena.NONE;
    private int firstChild = NodeArena.NONE;
    private int nextSibling = NodeArena.NONE;
    private int childCount;
    private boolean released;

    private long id;
    private NodeType type = NodeType.NONE;
    private final List<Property> properties = new ArrayList<>();
    private boolean solved;
    private boolean matchedTransposition;
    private boolean prunedBySearchWindow;
    private long treeSize;
    private long proofSize;

    SgfNode(NodeArena arena, int handle) {
        this.arena = arena;
        this.handle = handle;
    }

    // === Linkage ===

    /**
     * Append a node after the last existing child, detaching it from its current parent first.
     */
    public void addChild(SgfNode node) {
        Objects.requireNonNull(node, "node");
        ensureLive();
        if (node.arena != arena) {
            throw new IllegalArgumentException("Node " + node.handle + " belongs to another arena");
        }
        if (node == this) {
            throw new IllegalArgumentException("Node " + handle + " cannot be its own child");
        }
        // a childless node cannot be an ancestor
        if (node.childCount > 0) {
            for (int up = parent; up != NodeArena.NONE; up = arena.resolve(up).parent) {
                if (up == node.handle) {
                    throw new IllegalArgumentException("Node " + node.handle + " is an ancestor of " + handle);
                }
            }
        }
        node.detach();
        if (firstChild == NodeArena.NONE) {
            firstChild = node.handle;
        } else {
            var last = arena.resolve(firstChild);
            while (last.nextSibling != NodeArena.NONE) {
                last = arena.resolve(last.nextSibling);
            }
            last.nextSibling = node.handle;
        }
        node.parent = handle;
        childCount++;
    }

    /**
     * Unlink this node from its parent. The node keeps its own subtree.
     *
     * @return this node
     */
    public SgfNode detach() {
        ensureLive();
        if (parent == NodeArena.NONE) {
            return this;
        }
        var owner = arena.resolve(parent);
        if (owner.firstChild == handle) {
            owner.firstChild = nextSibling;
        } else {
            var previous = arena.resolve(owner.firstChild);
            while (previous.nextSibling != handle) {
                previous = arena.resolve(previous.nextSibling);
            }
            previous.nextSibling = nextSibling;
        }
        owner.childCount--;
        parent = NodeArena.NONE;
        nextSibling = NodeArena.NONE;
        return this;
    }

    public Optional<SgfNode> parent() {
        return link(parent);
    }

    public Optional<SgfNode> firstChild() {
        return link(firstChild);
    }

    public Optional<SgfNode> nextSibling() {
        return link(nextSibling);
    }

    /**
     * Children in document order.
     */
    public List<SgfNode> children() {
        var result = new ArrayList<SgfNode>(childCount);
        for (int h = firstChild; h != NodeArena.NONE; h = arena.resolve(h).nextSibling) {
            result.add(arena.resolve(h));
        }
        return result;
    }

    public int childCount() {
        return childCount;
    }

    public boolean isLeaf() {
        return childCount == 0;
    }

    public int handle() {
        return handle;
    }

    public NodeArena arena() {
        return arena;
    }

    public boolean isReleased() {
        return released;
    }

    int firstChildHandle() {
        return firstChild;
    }

    void markReleased() {
        released = true;
        parent = NodeArena.NONE;
        firstChild = NodeArena.NONE;
        nextSibling = NodeArena.NONE;
        childCount = 0;
    }

    private Optional<SgfNode> link(int target) {
        return target == NodeArena.NONE
               ? Optional.empty()
               : Optional.of(arena.resolve(target));
    }

    private void ensureLive() {
        if (released) {
            throw new IllegalStateException("Node " + handle + " has been released");
        }
    }

    // === Content ===

    public long id() {
        return id;
    }

    public void assignId(long id) {
        this.id = id;
    }

    public List<Property> properties() {
        return Collections.unmodifiableList(properties);
    }

    public void addProperty(Property property) {
        properties.add(Objects.requireNonNull(property, "property"));
    }

    public NodeType type() {
        return type;
    }

    public void setType(NodeType type) {
        this.type = Objects.requireNonNull(type, "type");
    }

    public boolean solved() {
        return solved;
    }

    public void setSolved(boolean solved) {
        this.solved = solved;
    }

    /**
     * Solved status was taken over from a previously solved, equivalent position.
     */
    public boolean matchedTransposition() {
        return matchedTransposition;
    }

    public void setMatchedTransposition(boolean matchedTransposition) {
        this.matchedTransposition = matchedTransposition;
    }

    /**
     * Solved status comes from a bounded search cutoff rather than full expansion.
     */
    public boolean prunedBySearchWindow() {
        return prunedBySearchWindow;
    }

    public void setPrunedBySearchWindow(boolean prunedBySearchWindow) {
        this.prunedBySearchWindow = prunedBySearchWindow;
    }

    public long treeSize() {
        return treeSize;
    }

    public long proofSize() {
        return proofSize;
    }

    public void setSizes(long treeSize, long proofSize) {
        this.treeSize = treeSize;
        this.proofSize = proofSize;
    }

    @Override
    public String toString() {
        return "SgfNode(id=" + id
               + ", type=" + type
               + ", tree_size=" + treeSize
               + ", proof_tree_size=" + proofSize
               + ", solved=" + solved
               + ")";
    }
}
