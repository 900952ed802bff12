package org.pragmatica.sgf.tree;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * Default node allocator: a contiguous store of nodes addressed by integer handles.
 *
 * <p>The handle of a node is its slot index. Slots are never reused, so a handle stays
 * unambiguous for the lifetime of the arena. Links between nodes (parent, first child,
 * next sibling) are plain handles into this arena; the arena alone owns node storage.
 */
public final class NodeArena implements NodeAllocator {
    /**
     * Handle value meaning "no node".
     */
    public static final int NONE = -1;

    private final List<SgfNode> slots;
    private int live;

    public NodeArena() {
        this.slots = new ArrayList<>();
        this.live = 0;
    }

    @Override
    public SgfNode allocate() {
        var node = new SgfNode(this, slots.size());
        slots.add(node);
        live++;
        return node;
    }

    @Override
    public boolean deallocate(SgfNode node) {
        Objects.requireNonNull(node, "node");
        if (!contains(node)) {
            return false;
        }
        node.detach();
        while (node.childCount() > 0) {
            resolve(node.firstChildHandle()).detach();
        }
        slots.set(node.handle(), null);
        node.markReleased();
        live--;
        return true;
    }

    /**
     * Release every live node at once.
     */
    public void releaseAll() {
        for (int i = 0; i < slots.size(); i++) {
            var node = slots.get(i);
            if (node != null) {
                node.markReleased();
                slots.set(i, null);
            }
        }
        live = 0;
    }

    /**
     * Check whether the node is a live node of this arena.
     */
    public boolean contains(SgfNode node) {
        return node.arena() == this
               && node.handle() < slots.size()
               && slots.get(node.handle()) == node;
    }

    /**
     * Look up a live node by handle.
     */
    public Optional<SgfNode> node(int handle) {
        if (handle < 0 || handle >= slots.size()) {
            return Optional.empty();
        }
        return Optional.ofNullable(slots.get(handle));
    }

    /**
     * Live nodes in allocation order.
     */
    public List<SgfNode> nodes() {
        var result = new ArrayList<SgfNode>(live);
        for (var node : slots) {
            if (node != null) {
                result.add(node);
            }
        }
        return result;
    }

    public int size() {
        return live;
    }

    SgfNode resolve(int handle) {
        var node = handle >= 0 && handle < slots.size() ? slots.get(handle) : null;
        if (node == null) {
            throw new IllegalStateException("Handle " + handle + " does not refer to a live node");
        }
        return node;
    }
}
